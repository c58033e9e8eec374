package io.landadvisor.reportservice.application.service.render;

/**
 * PDF document information dictionary values and the catalog /Lang entry.
 */
public record DocumentInfo(String title, String author, String subject, String languageTag) {
}
