package io.lendflow.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.lendflow.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAtEveryDepth() {
        Map<String, Object> borrower = new LinkedHashMap<>();
        borrower.put("name", "Pat Doe");
        borrower.put("SSN", "123-45-6789");
        borrower.put("date_of_birth", "1980-01-01");
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("borrower", borrower);
        input.put("accounts", List.of(Map.of("bank_account_number", "0012345", "balance", 1200)));
        input.put("loan_amount", 350000);

        Map<String, Object> masked = SensitiveDataMasker.masked(input);

        Map<?, ?> maskedBorrower = (Map<?, ?>) masked.get("borrower");
        Assertions.assertEquals("Pat Doe", maskedBorrower.get("name"));
        Assertions.assertEquals(SensitiveDataMasker.MASK, maskedBorrower.get("SSN"));
        Assertions.assertEquals(SensitiveDataMasker.MASK, maskedBorrower.get("date_of_birth"));
        Map<?, ?> account = (Map<?, ?>) ((List<?>) masked.get("accounts")).get(0);
        Assertions.assertEquals(SensitiveDataMasker.MASK, account.get("bank_account_number"));
        Assertions.assertEquals(1200, account.get("balance"));
        Assertions.assertEquals(350000, masked.get("loan_amount"));
        Assertions.assertEquals("123-45-6789", borrower.get("SSN"));
    }

    @Test
    void sensitiveContainerIsReplacedWhole() {
        JsonNode node = Jsons.mapper().valueToTree(Map.of("passport", Map.of("number", "X1", "country", "US")));
        JsonNode masked = SensitiveDataMasker.masked(node);
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("passport").asText());
    }

    @Test
    void keyMatchingIsCaseInsensitiveSubstring() {
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("Borrower_Tax_ID"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("PASSWORD_hash"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("credit_card_last4"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("credit_score"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(""));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(null));
    }

    @Test
    void emptyInputsStayEmpty() {
        Assertions.assertTrue(SensitiveDataMasker.masked((Map<String, Object>) null).isEmpty());
        Assertions.assertTrue(SensitiveDataMasker.masked((JsonNode) null).isNull());
    }
}
