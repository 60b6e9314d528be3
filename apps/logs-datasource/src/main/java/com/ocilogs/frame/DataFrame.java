package com.ocilogs.frame;

import java.util.List;
import java.util.Optional;

/**
 * Named set of columns answering one query.
 *
 * @param notices informational messages for the host, such as truncated results
 */
public record DataFrame(
        String name,
        List<TypedField> fields,
        List<String> notices
) {
    public DataFrame {
        fields = List.copyOf(fields);
        notices = notices == null ? List.of() : List.copyOf(notices);
    }

    public Optional<TypedField> field(String fieldName) {
        return fields.stream().filter(field -> field.name().equals(fieldName)).findFirst();
    }
}
