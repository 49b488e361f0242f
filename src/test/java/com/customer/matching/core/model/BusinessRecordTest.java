package com.customer.matching.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BusinessRecordTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("Stable ids")
    class StableIdTests {

        @Test
        @DisplayName("Should prefer id over customer_id")
        void idFirst() {
            Customer customer = Customer.of(Map.of("id", 1, "customer_id", "c1"));
            assertEquals(Optional.of("1"), customer.stableId());
        }

        @Test
        @DisplayName("Should skip null and blank id fields")
        void skipBlank() {
            Map<String, Object> attributes = new HashMap<>();
            attributes.put("id", null);
            attributes.put("customer_id", "");
            attributes.put("customerId", "C-9");
            assertEquals(Optional.of("C-9"), Customer.of(attributes).stableId());
        }

        @Test
        @DisplayName("Should report no id when none is present")
        void noId() {
            assertTrue(Employee.builder().role("analyst").build().stableId().isEmpty());
        }
    }

    @Nested
    @DisplayName("Records")
    class RecordTests {

        @Test
        @DisplayName("Builders should set the conventional fields")
        void builders() {
            Customer customer = Customer.builder().id("c1").name("Acme").industry("finance").build();
            Employee employee = Employee.builder().id("e1").name("Ada").role("banking analyst").build();

            assertEquals("Acme", customer.getName());
            assertEquals("Acme", customer.get("customer_name"));
            assertEquals("finance", customer.getIndustry());
            assertEquals("Ada", employee.getName());
            assertEquals("banking analyst", employee.getRole());
            assertNull(employee.getDescription());
        }

        @Test
        @DisplayName("Customer name should fall back to 'name'")
        void customerNameFallback() {
            assertEquals("Globex", Customer.of(Map.of("name", "Globex")).getName());
        }

        @Test
        @DisplayName("Attributes should be immutable")
        void immutable() {
            Customer customer = Customer.builder().id("c1").build();
            assertThrows(UnsupportedOperationException.class, () -> customer.attributes().put("x", 1));
        }

        @Test
        @DisplayName("Equality should be structural and type-aware")
        void equality() {
            Customer a = Customer.of(Map.of("id", "1"));
            Customer b = Customer.of(Map.of("id", "1"));
            Employee c = Employee.of(Map.of("id", "1"));

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, c);
        }

        @Test
        @DisplayName("Should serialize as a plain JSON object and read back")
        void json() throws Exception {
            Employee employee = Employee.builder().id("e1").role("designer").build();

            String json = mapper.writeValueAsString(employee);
            Employee read = mapper.readValue(json, Employee.class);

            assertEquals("{\"id\":\"e1\",\"role\":\"designer\"}", json);
            assertEquals(employee, read);
        }
    }

    @Nested
    @DisplayName("Confidence and MatchResult")
    class ResultTests {

        @Test
        @DisplayName("Should band similarities at 0.2, 0.4 and 0.6")
        void bands() {
            assertEquals(Confidence.VERY_LOW, Confidence.forSimilarity(0.0));
            assertEquals(Confidence.VERY_LOW, Confidence.forSimilarity(0.19));
            assertEquals(Confidence.LOW, Confidence.forSimilarity(0.2));
            assertEquals(Confidence.MEDIUM, Confidence.forSimilarity(0.4));
            assertEquals(Confidence.HIGH, Confidence.forSimilarity(0.6));
            assertEquals(Confidence.HIGH, Confidence.forSimilarity(1.0));
        }

        @Test
        @DisplayName("Should parse wire names leniently")
        void wireNames() {
            assertEquals(Confidence.VERY_LOW, Confidence.fromWireName("very_low"));
            assertEquals(Confidence.HIGH, Confidence.fromWireName(" HIGH "));
            assertNull(Confidence.fromWireName("certain"));
            assertNull(Confidence.fromWireName(null));
            assertEquals("medium", Confidence.MEDIUM.wireName());
        }

        @Test
        @DisplayName("fromCache should rebind the employee and retag the source")
        void fromCache() {
            Employee first = Employee.builder().id("e1").build();
            Employee caller = Employee.builder().id("e1").name("Ada").build();
            MatchResult remote = new MatchResult(first, 0.8, Confidence.HIGH, MatchSource.REMOTE);

            MatchResult cached = remote.fromCache(caller);

            assertSame(caller, cached.employee());
            assertEquals(MatchSource.CACHE, cached.source());
            assertEquals(0.8, cached.score());
            assertFalse(cached.isEstimated());
        }

        @Test
        @DisplayName("Should represent a missing score as NaN")
        void missingScore() {
            MatchResult result = new MatchResult(Employee.builder().build(), Double.NaN, null, MatchSource.REMOTE);
            assertFalse(result.hasScore());
            assertTrue(MatchResult.fallback(Employee.builder().build(), 0.1, Confidence.VERY_LOW).isEstimated());
        }

        @Test
        @DisplayName("Should require an employee and a source")
        void required() {
            assertThrows(NullPointerException.class, () -> new MatchResult(null, 0.5, Confidence.LOW, MatchSource.REMOTE));
            assertThrows(NullPointerException.class,
                    () -> new MatchResult(Employee.builder().build(), 0.5, Confidence.LOW, null));
        }
    }
}
