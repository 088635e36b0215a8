package com.frontdesk.domain.scenario.model.valobj;

/**
 * 编译时附加的来源信息。
 */
public record CompileOptions(String templateId, String categoryName) {

    private static final CompileOptions NONE = new CompileOptions(null, null);

    public static CompileOptions none() {
        return NONE;
    }

    public static CompileOptions of(String templateId, String categoryName) {
        return new CompileOptions(templateId, categoryName);
    }
}
