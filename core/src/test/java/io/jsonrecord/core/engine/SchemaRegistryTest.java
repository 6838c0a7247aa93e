package io.jsonrecord.core.engine;

import static io.jsonrecord.core.chain.Types.instanceOf;
import static io.jsonrecord.core.chain.Types.string;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsonrecord.core.error.DuplicateFieldException;
import io.jsonrecord.core.error.DuplicateSchemaException;
import io.jsonrecord.core.error.JsonRecordException;
import io.jsonrecord.core.error.SchemaNotFoundException;
import io.jsonrecord.core.model.FieldDescriptor;
import io.jsonrecord.core.model.FieldSpec;
import io.jsonrecord.core.model.SchemaOptions;
import io.jsonrecord.core.testkit.TestSchemas;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaRegistryTest")
class SchemaRegistryTest {

    private SchemaRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry("registry-test");
    }

    @Test
    @DisplayName("register derives descriptors from the chains")
    void registerDerivesDescriptors() {
        SchemaEntry coupon = TestSchemas.coupon(registry, SchemaOptions.DEFAULTS);

        assertThat(coupon.fieldNames()).containsExactly("code", "used");
        FieldDescriptor used = coupon.field("used");
        assertThat(used.readonly()).isTrue();
        assertThat(used.required()).isFalse();
        assertThat(used.hasDefault()).isTrue();
        assertThat(used.defaultProvider().get()).isEqualTo(false);
        assertThat(used.guarded()).isTrue();
        assertThat(coupon.field("code").guarded()).isFalse();
        assertThat(coupon.field("missing")).isNull();
    }

    @Test
    @DisplayName("duplicate type names are rejected")
    void duplicateType() {
        TestSchemas.article(registry);

        assertThatThrownBy(() -> TestSchemas.article(registry))
                .isInstanceOf(DuplicateSchemaException.class)
                .hasMessageContaining("'Article' is already registered in 'registry-test'")
                .extracting(e -> ((JsonRecordException) e).phase())
                .isEqualTo(JsonRecordException.Phase.DEFINITION);
    }

    @Test
    @DisplayName("duplicate field names are rejected and nothing is registered")
    void duplicateField() {
        List<FieldSpec> fields = List.of(FieldSpec.of("name", string()), FieldSpec.of("name", string().required()));

        assertThatThrownBy(() -> registry.register("Person", fields))
                .isInstanceOf(DuplicateFieldException.class)
                .hasMessageContaining("duplicate field 'name'");
        assertThat(registry.contains("Person")).isFalse();
    }

    @Test
    @DisplayName("lookup of an unregistered type fails with the registry name")
    void lookupMissing() {
        assertThatThrownBy(() -> registry.lookup("Ghost"))
                .isInstanceOf(SchemaNotFoundException.class)
                .hasMessage("Schema not found: no record type 'Ghost' registered in 'registry-test'")
                .satisfies(e -> assertThat(((SchemaNotFoundException) e).registryName()).isEqualTo("registry-test"));
        assertThat(registry.find("Ghost")).isEmpty();
    }

    @Test
    @DisplayName("instance references resolve lazily, so forward references work")
    void forwardReference() {
        SchemaEntry user = registry.define("User").field("address", instanceOf("Address")).register();
        TestSchemas.address(registry);

        JsonRecord record = user.create(Map.of("address", Map.of("zipcode", "0150")));

        assertThat(record.get("address", JsonRecord.class).schema().typeName()).isEqualTo("Address");
        assertThat(record.isValid()).isTrue();
    }

    @Test
    @DisplayName("self references build recursive records")
    void selfReference() {
        SchemaEntry node = registry.define("Node")
                .field("label", string())
                .field("next", instanceOf("Node"))
                .register();

        JsonRecord head = node.create(Map.of("label", "a", "next", Map.of("label", "b")));

        assertThat(head.get("next", JsonRecord.class).get("label")).isEqualTo("b");
        assertThat(head.toJsonString()).isEqualTo("{\"label\":\"a\",\"next\":{\"label\":\"b\",\"next\":null}}");
    }

    @Test
    @DisplayName("named registries are independent")
    void namedRegistriesAreIndependent() {
        SchemaRegistry other = new SchemaRegistry("other");
        TestSchemas.article(registry);
        TestSchemas.article(other);

        assertThat(registry.lookup("Article")).isNotSameAs(other.lookup("Article"));
        assertThat(registry.lookup("Article").registry()).isSameAs(registry);
        assertThat(other.contains("Person")).isFalse();
    }

    @Test
    @DisplayName("global registry is a process-wide singleton")
    void globalRegistry() {
        assertThat(SchemaRegistry.global()).isSameAs(SchemaRegistry.global());
        assertThat(SchemaRegistry.global().name()).isEqualTo("default");
    }

    @Test
    @DisplayName("typeNames is sorted and size tracks registrations")
    void typeNames() {
        TestSchemas.person(registry);
        TestSchemas.address(registry);
        TestSchemas.article(registry);

        assertThat(registry.typeNames()).containsExactly("Address", "Article", "Person");
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("concurrent lookups after registration see the same entry")
    void concurrentLookups() throws Exception {
        SchemaEntry article = TestSchemas.article(registry);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Callable<SchemaEntry> lookup = () -> registry.lookup("Article");
            List<Future<SchemaEntry>> results = pool.invokeAll(Collections.nCopies(32, lookup));
            for (Future<SchemaEntry> result : results) {
                assertThat(result.get()).isSameAs(article);
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
    }
}
