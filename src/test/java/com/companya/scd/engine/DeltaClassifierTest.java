package com.companya.scd.engine;

import com.companya.scd.exception.DuplicateKeyException;
import com.companya.scd.exception.InvariantViolationException;
import com.companya.scd.exception.MissingAttributeException;
import com.companya.scd.model.BusinessKey;
import com.companya.scd.model.Classification;
import com.companya.scd.model.Delta;
import com.companya.scd.model.Outcome;
import com.companya.scd.model.SourceRecord;
import com.companya.scd.model.TableConfiguration;
import com.companya.scd.model.VersionRow;
import com.companya.scd.model.Versioning;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DeltaClassifier Tests")
class DeltaClassifierTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 1, 19, 9, 0);

    private final FingerprintEngine fingerprintEngine = new FingerprintEngine();
    private final DeltaClassifier classifier = new DeltaClassifier(fingerprintEngine, false);

    private final TableConfiguration keepRemoved = config(false);
    private final TableConfiguration detectRemoved = config(true);

    @Nested
    @DisplayName("Outcome partition")
    class OutcomePartition {

        @Test
        @DisplayName("Absent, changed and equal keys map to NEW, CHANGED and UNCHANGED")
        void classifiesEachSourceKey() {
            List<SourceRecord> source = List.of(
                    record(1, "Laptop", "1299.99"),
                    record(2, "Mouse", "25.00"),
                    record(3, "Monitor", "199.00"));
            List<VersionRow> current = List.of(
                    currentRow(record(1, "Laptop", "999.99")),
                    currentRow(record(2, "Mouse", "25.00")));

            Delta delta = classifier.classify(source, current, keepRemoved);

            assertThat(delta.items()).extracting(Classification::outcome)
                    .containsExactly(Outcome.CHANGED, Outcome.UNCHANGED, Outcome.NEW);
            assertThat(delta.items().get(0).prior().key()).isEqualTo(BusinessKey.of(1));
            assertThat(delta.items().get(2).prior()).isNull();
            assertThat(delta.items()).allSatisfy(c -> assertThat(c.fingerprint()).isNotNull());
        }

        @Test
        @DisplayName("Classification is a pure function of its inputs")
        void isPure() {
            List<SourceRecord> source = List.of(record(1, "Laptop", "1299.99"), record(4, "Dock", "80"));
            List<VersionRow> current = List.of(currentRow(record(1, "Laptop", "999.99")), currentRow(record(9, "Old", "1")));

            assertThat(classifier.classify(source, current, detectRemoved))
                    .isEqualTo(classifier.classify(source, current, detectRemoved));
        }

        @Test
        @DisplayName("Parallel fingerprinting gives the same delta as the sequential path")
        void parallelMatchesSequential() {
            List<SourceRecord> source = IntStream.range(0, 500)
                    .mapToObj(i -> record(i, "item-" + i, String.valueOf(i)))
                    .toList();
            List<VersionRow> current = IntStream.range(0, 500)
                    .filter(i -> i % 3 == 0)
                    .mapToObj(i -> currentRow(record(i, "item-" + i, i % 2 == 0 ? String.valueOf(i) : "0.01")))
                    .toList();

            Delta sequential = classifier.classify(source, current, detectRemoved);
            Delta parallel = new DeltaClassifier(fingerprintEngine, true).classify(source, current, detectRemoved);

            assertThat(parallel).isEqualTo(sequential);
        }
    }

    @Nested
    @DisplayName("Removed keys")
    class RemovedKeys {

        @Test
        @DisplayName("Keys missing from the source are REMOVED when detection is on")
        void detectsRemoved() {
            VersionRow gone = currentRow(record(7, "Fax", "50"));
            Delta delta = classifier.classify(List.of(record(1, "Laptop", "999.99")),
                    List.of(currentRow(record(1, "Laptop", "999.99")), gone), detectRemoved);

            assertThat(delta.byOutcome(Outcome.REMOVED)).singleElement()
                    .satisfies(c -> {
                        assertThat(c.key()).isEqualTo(BusinessKey.of(7));
                        assertThat(c.prior()).isEqualTo(gone);
                        assertThat(c.source()).isNull();
                    });
        }

        @Test
        @DisplayName("Keys missing from the source are ignored when detection is off")
        void ignoresRemovedWhenDisabled() {
            Delta delta = classifier.classify(List.of(),
                    List.of(currentRow(record(7, "Fax", "50"))), keepRemoved);

            assertThat(delta.items()).isEmpty();
            assertThat(delta.hasMutations()).isFalse();
        }
    }

    @Nested
    @DisplayName("Structural errors")
    class StructuralErrors {

        @Test
        @DisplayName("Duplicate business key in source raises DuplicateKey")
        void duplicateSourceKey() {
            List<SourceRecord> source = List.of(record(1, "Laptop", "1"), record(1, "Laptop Pro", "2"));

            assertThatThrownBy(() -> classifier.classify(source, List.of(), keepRemoved))
                    .isInstanceOf(DuplicateKeyException.class)
                    .hasMessageContaining("1");
        }

        @Test
        @DisplayName("Two current versions of one key raise InvariantViolation")
        void duplicateCurrentRows() {
            List<VersionRow> current = List.of(currentRow(record(1, "A", "1")), currentRow(record(1, "B", "2")));

            assertThatThrownBy(() -> classifier.classify(List.of(record(1, "A", "1")), current, keepRemoved))
                    .isInstanceOf(InvariantViolationException.class)
                    .hasMessageContaining("more than one current version");
        }

        @Test
        @DisplayName("Superseded row in the current slice raises InvariantViolation")
        void supersededRowInSlice() {
            SourceRecord attrs = record(1, "A", "1");
            VersionRow closed = new VersionRow(BusinessKey.of(1), attrs, fingerprintEngine.fingerprint(attrs, keepRemoved.monitoredAttributes()),
                    T0.minusDays(1), T0, false);

            assertThatThrownBy(() -> classifier.classify(List.of(attrs), List.of(closed), keepRemoved))
                    .isInstanceOf(InvariantViolationException.class);
        }

        @Test
        @DisplayName("Null business key is a data error")
        void nullKey() {
            SourceRecord noKey = SourceRecord.builder().put("id", null).put("product_name", "X").put("price", 1).build();

            assertThatThrownBy(() -> classifier.classify(List.of(noKey), List.of(), keepRemoved))
                    .isInstanceOf(MissingAttributeException.class);
        }

        @Test
        @DisplayName("Source record without a monitored attribute raises MissingAttribute")
        void missingMonitoredAttribute() {
            SourceRecord partial = SourceRecord.builder().put("id", 1).put("product_name", "X").build();

            assertThatThrownBy(() -> classifier.classify(List.of(partial), List.of(), keepRemoved))
                    .isInstanceOf(MissingAttributeException.class);
        }
    }

    private VersionRow currentRow(SourceRecord attributes) {
        return new VersionRow(new BusinessKey(attributes.get("id")), attributes,
                fingerprintEngine.fingerprint(attributes, keepRemoved.monitoredAttributes()),
                T0, Versioning.OPEN_END, true);
    }

    private static SourceRecord record(int id, String name, String price) {
        return SourceRecord.builder()
                .put("id", id)
                .put("product_name", name)
                .put("price", new BigDecimal(price))
                .build();
    }

    private static TableConfiguration config(boolean detectRemoved) {
        return new TableConfiguration("sales", "sales_records", "sales_records_cdc", "id",
                List.of("product_name", "price"), detectRemoved);
    }
}
