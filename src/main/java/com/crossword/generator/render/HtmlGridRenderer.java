package com.crossword.generator.render;

import com.crossword.generator.util.FileWriteUtil;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTML table rendering driven by the {@code crossword.html.ftl} template.
 */
public class HtmlGridRenderer implements GridRenderer {

    static final String TEMPLATE_NAME = "crossword.html.ftl";

    private final Configuration freemarkerConfig;

    public HtmlGridRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(LetterGrid grid) throws IOException {
        Map<String, Object> data = new HashMap<>();
        data.put("width", grid.getWidth());
        data.put("height", grid.getHeight());
        data.put("rows", rows(grid));

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        try {
            template.process(data, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    @Override
    public void write(LetterGrid grid, Path output) throws IOException {
        FileWriteUtil.safeWriteString(output, render(grid));
    }

    private List<List<Map<String, Object>>> rows(LetterGrid grid) {
        List<List<Map<String, Object>>> rows = new ArrayList<>();
        for (int i = 0; i < grid.getHeight(); i++) {
            List<Map<String, Object>> row = new ArrayList<>();
            for (int j = 0; j < grid.getWidth(); j++) {
                Map<String, Object> cell = new HashMap<>();
                cell.put("open", grid.isOpen(i, j));
                Character letter = grid.letterAt(i, j);
                cell.put("letter", letter == null ? "" : letter.toString());
                row.add(cell);
            }
            rows.add(row);
        }
        return rows;
    }
}
