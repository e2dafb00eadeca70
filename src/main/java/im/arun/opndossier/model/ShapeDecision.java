package im.arun.opndossier.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Result of classifying one value. Records carry their fields, sequences
 * their elements and containers their key-sorted entries; other shapes carry
 * no entries.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ShapeDecision {
    Shape shape;
    String label;
    Object value;
    boolean omitted;
    List<NamedValue> fields;
    List<Object> elements;

    public static ShapeDecision absent(String label) {
        return new ShapeDecision(Shape.OPTIONAL, label, null, true, List.of(), List.of());
    }

    public static ShapeDecision scalar(String label, Object value, boolean zero) {
        return new ShapeDecision(Shape.SCALAR, label, value, zero, List.of(), List.of());
    }

    public static ShapeDecision marker(String label, Object value) {
        return new ShapeDecision(Shape.EMPTY_MARKER, label, value, false, List.of(), List.of());
    }

    public static ShapeDecision record(String label, Object value, List<NamedValue> fields) {
        return new ShapeDecision(Shape.RECORD, label, value, false, List.copyOf(fields), List.of());
    }

    public static ShapeDecision sequence(String label, Object value, List<Object> elements) {
        return new ShapeDecision(Shape.ORDERED_SEQUENCE, label, value, elements.isEmpty(),
            List.of(), Collections.unmodifiableList(elements));
    }

    public static ShapeDecision container(String label, Object value, List<NamedValue> entries) {
        return new ShapeDecision(Shape.KEY_VALUE_CONTAINER, label, value, entries.isEmpty(),
            List.copyOf(entries), List.of());
    }

    public boolean isAbsent() {
        return shape == Shape.OPTIONAL;
    }

    /**
     * True when the value produces a body line on its parent.
     */
    public boolean isInline() {
        return !omitted && shape.isInline();
    }

    /**
     * True when the value produces a child node of its own.
     */
    public boolean isStructured() {
        return !omitted && shape.isStructured();
    }
}
