package com.verolang.core.ast;

/**
 * Declared value types.
 */
public enum VarType {
    TEXT("string"),
    NUMBER("number"),
    FLAG("boolean"),
    LIST("any[]");

    private final String typeScriptType;

    VarType(String typeScriptType) {
        this.typeScriptType = typeScriptType;
    }

    public String typeScriptType() {
        return typeScriptType;
    }
}
