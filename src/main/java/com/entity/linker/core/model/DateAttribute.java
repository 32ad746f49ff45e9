package com.entity.linker.core.model;

import java.util.List;

/**
 * Partial dates, such as birth or death dates known only to the year.
 */
public record DateAttribute(List<PartialDate> dates) implements Attribute {

    public DateAttribute {
        dates = dates != null ? List.copyOf(dates) : List.of();
    }

    public static DateAttribute of(PartialDate... dates) {
        return new DateAttribute(List.of(dates));
    }

    @Override
    public AttributeKind kind() {
        return AttributeKind.DATE;
    }

    @Override
    public List<String> asStrings() {
        return dates.stream().map(PartialDate::toString).toList();
    }
}
