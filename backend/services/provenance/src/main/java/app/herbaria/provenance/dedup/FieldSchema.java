package app.herbaria.provenance.dedup;

import app.herbaria.provenance.config.SchemaProps;
import app.herbaria.provenance.domain.model.FieldValue;
import app.herbaria.provenance.domain.type.DwcTerm;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits provider output into the fixed term schema and the extras bucket.
 *
 * <p>Only schema terms are ever aggregated. Extras are kept on the attempt for provenance; names
 * not in the extras registry are kept too, with a warning on the attempt.
 */
@Component
public class FieldSchema {

    private final Set<String> registeredExtras;

    public FieldSchema(SchemaProps props) {
        this.registeredExtras = Set.copyOf(props.extraTerms());
    }

    public Split split(Map<String, FieldValue> raw) {
        Map<DwcTerm, FieldValue> known = new EnumMap<>(DwcTerm.class);
        Map<String, FieldValue> extras = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        raw.forEach((name, value) -> {
            if (value == null) {
                return;
            }
            var term = DwcTerm.fromName(name);
            if (term.isPresent()) {
                putKnown(term.get(), name, value, known, extras, warnings);
                return;
            }
            extras.put(name, value);
            if (!registeredExtras.contains(name)) {
                warnings.add("unregistered term " + name);
            }
        });
        return new Split(known, extras, warnings);
    }

    // Several raw names may resolve to one term (catalogNumber, dwc:catalogNumber). A present value
    // replaces a blank one; a second present value stays in extras under its raw name.
    private static void putKnown(DwcTerm term, String name, FieldValue value,
                                 Map<DwcTerm, FieldValue> known,
                                 Map<String, FieldValue> extras,
                                 List<String> warnings) {
        FieldValue current = known.get(term);
        if (current == null || (!current.isPresent() && value.isPresent())) {
            known.put(term, value);
            return;
        }
        if (value.isPresent()) {
            extras.put(name, value);
            warnings.add("alias collision " + name);
        }
    }

    public record Split(
            Map<DwcTerm, FieldValue> known,
            Map<String, FieldValue> extras,
            List<String> warnings
    ) {
        public boolean hasValues() {
            return known.values().stream().anyMatch(FieldValue::isPresent)
                    || extras.values().stream().anyMatch(FieldValue::isPresent);
        }
    }
}
