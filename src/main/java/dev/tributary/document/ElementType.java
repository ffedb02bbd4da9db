package dev.tributary.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Category of a partitioned {@link Element}. */
public enum ElementType {
    TITLE("Title"),
    NARRATIVE_TEXT("NarrativeText"),
    LIST_ITEM("ListItem"),
    TABLE("Table"),
    CODE_SNIPPET("CodeSnippet"),
    COMPOSITE_ELEMENT("CompositeElement");

    private final String value;

    ElementType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ElementType fromValue(String value) {
        for (ElementType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid element type: " + value);
    }
}
