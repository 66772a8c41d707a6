package org.epubmeta.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings of the EPUB editor. Defaults apply unless a classpath resource {@value #RESOURCE} overrides them.
 */
@Slf4j
@Getter
@Setter
public class EpubProperties {

    public static final String RESOURCE = "epub-meta.properties";

    /**
     * Manifest ID (and file base name) of cover images added by this library. Items carrying this ID are considered
     * ours and get deleted together with the cover pointer.
     */
    private String coverId = "epub-meta-cover";

    /**
     * Manifest ID (and file base name) of generated title pages.
     */
    private String titlePageId = "epub-meta-titlepage";

    /**
     * Classpath location of the XHTML template for generated title pages.
     */
    private String titlePageTemplate = "templates/cover-titlepage.xhtml";

    /**
     * Whether every navigation point has to reference a file declared in the manifest.
     */
    private boolean validateTocReferences = true;

    public static EpubProperties load() {
        EpubProperties properties = new EpubProperties();
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = classLoader != null ? classLoader.getResourceAsStream(RESOURCE) : null) {
            if (in == null) {
                return properties;
            }
            Properties values = new Properties();
            values.load(in);
            properties.apply(values);
            log.debug("Loaded EPUB settings from {}", RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RESOURCE, e);
        }
        return properties;
    }

    public void apply(Properties values) {
        coverId = StringUtils.defaultIfBlank(values.getProperty("epub.cover-id"), coverId);
        titlePageId = StringUtils.defaultIfBlank(values.getProperty("epub.title-page-id"), titlePageId);
        titlePageTemplate = StringUtils.defaultIfBlank(values.getProperty("epub.title-page-template"), titlePageTemplate);
        String validate = values.getProperty("epub.validate-toc-references");
        if (StringUtils.isNotBlank(validate)) {
            validateTocReferences = BooleanUtils.toBoolean(validate.trim());
        }
    }
}
