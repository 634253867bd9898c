package com.market.sentiment.entity;

import java.util.Locale;

/**
 * 内容来源类型。sourceKey 与原 dim_sources 维表的编号保持一致，未知来源为 0。
 */
public enum SourceKind {
    SOCIAL(1),
    NEWS(2);

    private final int sourceKey;

    SourceKind(int sourceKey) {
        this.sourceKey = sourceKey;
    }

    public int getSourceKey() {
        return sourceKey;
    }

    /** 落库使用的小写名称：social / news */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static int keyOf(String code) {
        if (code == null) {
            return 0;
        }
        for (SourceKind kind : values()) {
            if (kind.code().equalsIgnoreCase(code)) {
                return kind.sourceKey;
            }
        }
        return 0;
    }
}
