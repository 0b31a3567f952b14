package com.lead.discovery.lead;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Classifies a scraped web form by its field names. Rules are tried in order and the first
 * hit wins: contact, quote, application, newsletter, then lead capture as the fallback.
 *
 * <p>An email field alone only makes a form a contact form when the form has more than two
 * fields; short email forms are newsletter sign-ups.</p>
 */
public class FormClassifier {

    private static final Set<String> CONTACT_FIELDS = Set.of("name", "message");
    private static final Set<String> QUOTE_FIELDS = Set.of("quote", "budget", "project");
    private static final Set<String> APPLICATION_FIELDS = Set.of("application", "loan", "amount");
    private static final int NEWSLETTER_MAX_FIELDS = 2;

    public FormType classify(Collection<String> fieldNames) {
        List<String> fields = fieldNames.stream()
                .filter(f -> f != null && !f.isBlank())
                .map(f -> f.trim().toLowerCase(Locale.ROOT))
                .toList();
        boolean hasEmail = fields.contains("email");

        if (fields.stream().anyMatch(CONTACT_FIELDS::contains)
                || (hasEmail && fields.size() > NEWSLETTER_MAX_FIELDS)) {
            return FormType.CONTACT;
        }
        if (fields.stream().anyMatch(QUOTE_FIELDS::contains)) {
            return FormType.QUOTE;
        }
        if (fields.stream().anyMatch(APPLICATION_FIELDS::contains)) {
            return FormType.APPLICATION;
        }
        if (hasEmail) {
            return FormType.NEWSLETTER;
        }
        return FormType.LEAD_CAPTURE;
    }

    /**
     * Counts forms per type. Every type is present in the result.
     */
    public Map<FormType, Integer> analyze(Collection<? extends Collection<String>> forms) {
        Map<FormType, Integer> counts = new EnumMap<>(FormType.class);
        for (FormType type : FormType.values()) {
            counts.put(type, 0);
        }
        for (Collection<String> form : forms) {
            counts.merge(classify(form), 1, Integer::sum);
        }
        return counts;
    }
}
