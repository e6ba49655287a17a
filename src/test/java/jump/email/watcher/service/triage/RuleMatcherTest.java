package jump.email.watcher.service.triage;

import jump.email.watcher.config.HooksProperties;
import jump.email.watcher.model.EmailAddress;
import jump.email.watcher.model.MessageSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleMatcherTest {

    private static final MessageSummary INVOICE = MessageSummary.builder()
            .id("7")
            .subject("Invoice #1234 for March")
            .from(new EmailAddress("Billing Team", "billing@Vendor.example.com"))
            .recipient(new EmailAddress(null, "me@example.com"))
            .build();

    private static HooksProperties.Rule rule(String name, String from, String to, String subject) {
        HooksProperties.Rule rule = new HooksProperties.Rule();
        rule.setName(name);
        rule.getMatch().setFrom(from);
        rule.getMatch().setTo(to);
        rule.getMatch().setSubject(subject);
        return rule;
    }

    @Test
    void globMatches_ShouldBeCaseInsensitiveWithWildcards() {
        assertTrue(RuleMatcher.globMatches("*@vendor.example.com", "billing@Vendor.example.com"));
        assertTrue(RuleMatcher.globMatches("invoice*", "Invoice #1234"));
        assertTrue(RuleMatcher.globMatches("*march", "Invoice for MARCH"));
        assertFalse(RuleMatcher.globMatches("invoice", "Invoice #1234"));
        assertFalse(RuleMatcher.globMatches("*.com", null));
    }

    @Test
    void globMatches_ShouldTreatRegexCharactersLiterally() {
        assertTrue(RuleMatcher.globMatches("invoice #1234 (draft)", "Invoice #1234 (draft)"));
        assertFalse(RuleMatcher.globMatches("a.c", "abc"));
    }

    @Test
    void matches_ShouldRequireEveryGivenField() {
        assertTrue(RuleMatcher.matches(rule("r", "*@vendor.example.com", null, "invoice*"), INVOICE));
        assertFalse(RuleMatcher.matches(rule("r", "*@vendor.example.com", null, "receipt*"), INVOICE));
        assertTrue(RuleMatcher.matches(rule("r", null, "me@example.com", null), INVOICE));
        assertFalse(RuleMatcher.matches(rule("r", null, "other@example.com", null), INVOICE));
    }

    @Test
    void matches_FromPattern_ShouldAlsoMatchDisplayName() {
        assertTrue(RuleMatcher.matches(rule("r", "*team", null, null), INVOICE));
    }

    @Test
    void matches_RuleWithoutPatterns_ShouldNeverMatch() {
        assertFalse(RuleMatcher.matches(rule("empty", null, " ", null), INVOICE));
    }

    @Test
    void firstMatch_ShouldReturnFirstRuleInOrder() {
        List<HooksProperties.Rule> rules = List.of(
                rule("newsletters", "*@news.example.com", null, null),
                rule("vendor", "*@vendor.example.com", null, null),
                rule("invoices", null, null, "*invoice*"));

        assertEquals("vendor", RuleMatcher.firstMatch(rules, INVOICE).map(HooksProperties.Rule::getName).orElse(null));
        assertTrue(RuleMatcher.firstMatch(List.of(), INVOICE).isEmpty());
    }
}
