package com.pagefetch.core.parse;

import org.jsoup.nodes.Attributes;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * (요소명, 속성값) 규칙 하나. 속성값은 원문 그대로 비교한다(앞뒤 공백 포함).
 */
public record FilterRule(String elementName, String attribute, Set<String> acceptedValues) {

    public FilterRule {
        Objects.requireNonNull(elementName, "elementName");
        Objects.requireNonNull(attribute, "attribute");
        elementName = elementName.toLowerCase(Locale.ROOT);
        acceptedValues = Set.copyOf(acceptedValues);
        if (acceptedValues.isEmpty()) throw new IllegalArgumentException("acceptedValues must not be empty");
    }

    public static FilterRule of(String elementName, String attribute, String... values) {
        return new FilterRule(elementName, attribute, Set.of(values));
    }

    public boolean matches(String name, Attributes attrs) {
        if (name == null || attrs == null) return false;
        if (!elementName.equalsIgnoreCase(name)) return false;
        if (!attrs.hasKey(attribute)) return false;
        return acceptedValues.contains(attrs.get(attribute));
    }
}
