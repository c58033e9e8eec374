package io.landadvisor.reportservice.application.service.render;

import io.landadvisor.reportservice.domain.exception.ReportConfigurationException;
import io.landadvisor.reportservice.domain.model.valueobject.ScriptClass;
import io.landadvisor.reportservice.domain.model.valueobject.TextStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The four report faces, loaded once at startup. A missing or unreadable font is fatal and
 * surfaces as {@link ReportConfigurationException} before any request is served.
 */
public final class FontRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FontRegistry.class);

    private final Map<FontKey, FontFace> faces;

    private FontRegistry(Map<FontKey, FontFace> faces) {
        this.faces = Collections.unmodifiableMap(faces);
    }

    public static FontRegistry load(Map<FontKey, String> locations, ResourceLoader resourceLoader) {
        Map<FontKey, FontFace> faces = new EnumMap<>(FontKey.class);
        for (FontKey key : FontKey.values()) {
            String location = locations.get(key);
            if (location == null || location.isBlank()) {
                throw new ReportConfigurationException("No font configured for " + key);
            }
            FontFace face = loadFace(key, location, resourceLoader.getResource(location));
            logger.info("Loaded font {} from {} ({} code points mapped)", key, location, face.mappedCodePoints());
            faces.put(key, face);
        }
        return new FontRegistry(faces);
    }

    private static FontFace loadFace(FontKey key, String location, Resource resource) {
        if (!resource.exists()) {
            throw new ReportConfigurationException("Font not found: " + location + " (" + key + ")");
        }
        byte[] data;
        try (InputStream in = resource.getInputStream()) {
            data = in.readAllBytes();
        } catch (IOException e) {
            throw new ReportConfigurationException("Font could not be read: " + location, e);
        }
        try {
            return FontFace.parse(key, location, data);
        } catch (IOException | RuntimeException e) {
            throw new ReportConfigurationException("Not a usable TrueType font: " + location + " (" + key + ")", e);
        }
    }

    public FontFace face(FontKey key) {
        return faces.get(key);
    }

    public FontFace primary(ScriptClass script, TextStyle style) {
        return faces.get(FontKey.of(script, style));
    }

    /**
     * Face that draws {@code codePoint} for text of the given script and style: the primary
     * face, else the same-weight face of the other script, else {@code null}.
     */
    public FontFace resolve(int codePoint, ScriptClass script, TextStyle style) {
        FontKey key = FontKey.of(script, style);
        FontFace primary = faces.get(key);
        if (primary.covers(codePoint)) return primary;
        FontFace sibling = faces.get(key.sibling());
        return sibling.covers(codePoint) ? sibling : null;
    }
}
