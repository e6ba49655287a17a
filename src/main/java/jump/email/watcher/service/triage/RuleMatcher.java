package jump.email.watcher.service.triage;

import jump.email.watcher.config.HooksProperties;
import jump.email.watcher.model.EmailAddress;
import jump.email.watcher.model.MessageSummary;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches messages against user-defined rules. Patterns are case-insensitive globs where
 * {@code *} matches any run of characters; a rule matches when every pattern it sets matches.
 */
public final class RuleMatcher {

    private RuleMatcher() {
    }

    /**
     * @return the first rule, in configuration order, that matches the message
     */
    public static Optional<HooksProperties.Rule> firstMatch(List<HooksProperties.Rule> rules, MessageSummary meta) {
        if (rules == null) {
            return Optional.empty();
        }
        return rules.stream().filter(rule -> matches(rule, meta)).findFirst();
    }

    public static boolean matches(HooksProperties.Rule rule, MessageSummary meta) {
        HooksProperties.Match match = rule.getMatch();
        if (match == null || (isUnset(match.getFrom()) && isUnset(match.getTo()) && isUnset(match.getSubject()))) {
            return false;
        }
        if (!isUnset(match.getFrom()) && !matchesAddress(match.getFrom(), meta.getFrom())) {
            return false;
        }
        if (!isUnset(match.getTo())
                && meta.getTo().stream().noneMatch(recipient -> matchesAddress(match.getTo(), recipient))) {
            return false;
        }
        return isUnset(match.getSubject()) || globMatches(match.getSubject(), meta.getSubject());
    }

    static boolean globMatches(String glob, String value) {
        if (value == null) {
            return false;
        }
        String regex = Arrays.stream(glob.split("\\*", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*"));
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL)
                .matcher(value)
                .matches();
    }

    private static boolean matchesAddress(String glob, EmailAddress address) {
        if (address == null) {
            return false;
        }
        return globMatches(glob, address.getAddress())
                || (address.getName() != null && globMatches(glob, address.getName()));
    }

    private static boolean isUnset(String pattern) {
        return pattern == null || pattern.isBlank();
    }
}
