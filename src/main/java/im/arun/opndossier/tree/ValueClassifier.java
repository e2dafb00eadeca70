package im.arun.opndossier.tree;

import im.arun.opndossier.config.WalkerConfig;
import im.arun.opndossier.model.NamedValue;
import im.arun.opndossier.model.ShapeDecision;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides the shape of a configuration value and, for structured shapes,
 * lists what lies beneath it in a stable order.
 */
public class ValueClassifier {

    private final String identityField;
    private final String markerText;

    public ValueClassifier(WalkerConfig config) {
        this.identityField = config.getIdentityField();
        this.markerText = config.getMarkerText();
    }

    /**
     * Classify a value reached through the given label.
     *
     * @throws UnsupportedShapeException if the value's type has no shape
     */
    public ShapeDecision classify(String label, Object value) {
        if (value instanceof Optional) {
            Optional<?> optional = (Optional<?>) value;
            if (optional.isEmpty()) {
                return ShapeDecision.absent(label);
            }
            return classify(label, optional.get());
        }
        if (value == null) {
            return ShapeDecision.absent(label);
        }

        if (isScalar(value)) {
            return ShapeDecision.scalar(label, value, isZero(value));
        }

        if (value instanceof Walkable) {
            // Marker status depends on the declared fields, identity field included
            List<NamedValue> declared = fieldsOf((Walkable) value);
            if (declared.isEmpty()) {
                return ShapeDecision.marker(label, value);
            }
            List<NamedValue> fields = new ArrayList<>(declared.size());
            for (NamedValue field : declared) {
                if (!isIdentityField(field.getLabel())) {
                    fields.add(field);
                }
            }
            return ShapeDecision.record(label, value, fields);
        }

        if (value instanceof Collection) {
            return ShapeDecision.sequence(label, value, new ArrayList<>((Collection<?>) value));
        }

        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return ShapeDecision.sequence(label, value, elements);
        }

        if (value instanceof Map) {
            return ShapeDecision.container(label, value, sortedEntries((Map<?, ?>) value));
        }

        throw new UnsupportedShapeException(label, value);
    }

    /**
     * Text written for an inline value: the value itself for scalars, the
     * marker text for presence flags.
     */
    public String inlineText(ShapeDecision decision) {
        switch (decision.getShape()) {
            case EMPTY_MARKER:
                return markerText;
            case SCALAR:
                Object value = decision.getValue();
                if (value instanceof BigDecimal) {
                    return ((BigDecimal) value).toPlainString();
                }
                return String.valueOf(value);
            default:
                throw new IllegalArgumentException("Not an inline shape: " + decision.getShape());
        }
    }

    public boolean isIdentityField(String label) {
        return identityField != null && identityField.equals(label);
    }

    private List<NamedValue> fieldsOf(Walkable walkable) {
        List<NamedValue> fields = new ArrayList<>();
        walkable.visitFields((name, fieldValue) -> fields.add(new NamedValue(name, fieldValue)));
        return fields;
    }

    private List<NamedValue> sortedEntries(Map<?, ?> map) {
        List<NamedValue> entries = new ArrayList<>(map.size());
        map.forEach((key, entryValue) -> entries.add(new NamedValue(String.valueOf(key), entryValue)));
        entries.sort(Comparator.comparing(NamedValue::getLabel));
        return entries;
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof Character
            || value instanceof Enum;
    }

    private static boolean isZero(Object value) {
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() == 0;
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        if (value instanceof Character) {
            return (Character) value == '\0';
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum() == 0;
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).signum() == 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 0.0;
        }
        return false;
    }
}
