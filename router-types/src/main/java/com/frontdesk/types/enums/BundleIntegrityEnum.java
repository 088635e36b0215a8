package com.frontdesk.types.enums;

/**
 * Truth Bundle 完整性等级，按严重程度递增。
 */
public enum BundleIntegrityEnum {

    COMPLETE(0),
    DEGRADED(1),
    INVALID(2),
    FAILED(3);

    private final int severity;

    BundleIntegrityEnum(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * 只升不降：返回当前等级与目标等级中更严重的一个。
     */
    public BundleIntegrityEnum atLeast(BundleIntegrityEnum other) {
        if (other == null) {
            return this;
        }
        return other.severity > this.severity ? other : this;
    }

    public boolean isComplete() {
        return this == COMPLETE;
    }
}
