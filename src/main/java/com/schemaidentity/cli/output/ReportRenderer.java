package com.schemaidentity.cli.output;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.schemaidentity.identity.IdentityReport;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders {@link IdentityReport}s as human-readable text (FreeMarker template) or as
 * JSON with snake_case keys.
 */
public class ReportRenderer {

    static final String REPORT_TEMPLATE = "identity-report.ftl";

    private final Configuration freemarker;
    private final ObjectMapper json;

    public ReportRenderer() {
        this.freemarker = createFreemarkerConfig();
        this.json = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
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

    public String renderText(IdentityReport report) {
        Map<String, Object> model = new HashMap<>();
        model.put("report", report);
        model.put("createdAt", report.getCreatedAt().toString());
        model.put("settings", report.getHashSettings());
        try {
            Template template = freemarker.getTemplate(REPORT_TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load template " + REPORT_TEMPLATE, e);
        } catch (TemplateException e) {
            throw new IllegalStateException("Could not render template " + REPORT_TEMPLATE, e);
        }
    }

    public String renderJson(IdentityReport report) {
        try {
            return json.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render report as JSON", e);
        }
    }
}
