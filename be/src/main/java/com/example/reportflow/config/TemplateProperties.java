package com.example.reportflow.config;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configures the workflow templates loaded at start-up.
 */
@ConfigurationProperties(prefix = "reportflow.templates")
@Getter
@Setter
public class TemplateProperties {

    /** Classpath locations of template JSON files, loaded in order. */
    private List<String> locations = new ArrayList<>();
}
