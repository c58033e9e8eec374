package io.landadvisor.reportservice.domain.model.valueobject;

public enum ScriptClass {
    LATIN,
    DEVANAGARI
}
