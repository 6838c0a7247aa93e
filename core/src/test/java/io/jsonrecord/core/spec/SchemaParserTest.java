package io.jsonrecord.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsonrecord.core.engine.JsonRecord;
import io.jsonrecord.core.engine.SchemaEntry;
import io.jsonrecord.core.engine.SchemaRegistry;
import io.jsonrecord.core.error.DuplicateFieldException;
import io.jsonrecord.core.error.DuplicateSchemaException;
import io.jsonrecord.core.error.IncompatibleOperatorException;
import io.jsonrecord.core.error.SchemaDefinitionException;
import io.jsonrecord.core.error.SchemaParseException;
import io.jsonrecord.core.error.UnexpectedFieldException;
import io.jsonrecord.core.model.ExtraFieldPolicy;
import io.jsonrecord.core.model.KeyCasePolicy;
import io.jsonrecord.core.model.ReadonlyViolationPolicy;
import io.jsonrecord.core.model.ValidationError;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SchemaParserTest")
class SchemaParserTest {

    private SchemaRegistry registry;
    private SchemaParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry("parser-test");
        parser = new SchemaParser(registry);
    }

    private static Path definitions() throws URISyntaxException {
        return Path.of(SchemaParserTest.class.getResource("/definitions").toURI());
    }

    private Path write(String name, String yaml) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("valid definitions")
    class ValidDefinitions {

        @Test
        @DisplayName("single-type file registers its type with options and chains")
        void singleType() throws Exception {
            List<SchemaEntry> entries = parser.parse(definitions().resolve("article.yaml"));

            assertThat(entries).extracting(SchemaEntry::typeName).containsExactly("Article");
            SchemaEntry article = registry.lookup("Article");
            assertThat(article.options().keyCase()).isEqualTo(KeyCasePolicy.SNAKE_CAMEL);
            assertThat(article.options().extraFields()).isEqualTo(ExtraFieldPolicy.REJECT);
            assertThat(article.source()).endsWith("article.yaml");
            assertThat(article.field("title").chain().toString()).isEqualTo("str.required.trim.maxlength(100)");
            assertThat(article.field("tags").chain().toString()).isEqualTo("listof(str.trim.tolower)");
            assertThat(article.field("published").readonly()).isTrue();
        }

        @Test
        @DisplayName("parsed types behave like types declared in code")
        void parsedArticleBehaves() throws Exception {
            parser.parse(definitions().resolve("article.yaml"));
            SchemaEntry article = registry.lookup("Article");

            JsonRecord record = article.fromJson(
                    "{\"title\":\" Hi \",\"content\":\"Body\",\"tags\":[\" Java\"],\"published\":true}");

            assertThat(record.isValid()).isTrue();
            assertThat(record.toJsonString()).isEqualTo(
                    "{\"title\":\"Hi\",\"content\":\"Body\",\"readCount\":0,\"tags\":[\"java\"],\"published\":false}");
            assertThatThrownBy(() -> article.create(Map.of("title", "x", "slug", "y")))
                    .isInstanceOf(UnexpectedFieldException.class);
        }

        @Test
        @DisplayName("multi-type file registers every type in order")
        void multiType() throws Exception {
            List<SchemaEntry> entries = parser.parse(definitions().resolve("people.yaml"));

            assertThat(entries).extracting(SchemaEntry::typeName).containsExactly("Address", "Person");
            assertThat(registry.lookup("Person").options().readonlyViolation())
                    .isEqualTo(ReadonlyViolationPolicy.REJECT);
            assertThat(registry.lookup("Person").field("password").writeonly()).isTrue();
            assertThat(registry.lookup("Person").field("email").writeonce()).isTrue();
        }

        @Test
        @DisplayName("rules from file report nested failures with full paths")
        void multiTypeValidation() throws Exception {
            parser.parse(definitions().resolve("people.yaml"));

            JsonRecord person = registry.lookup("Person").create(Map.of(
                    "name", "",
                    "gender", "other",
                    "age", 200,
                    "email", "nope",
                    "address", Map.of("zipcode", "12345")));

            assertThat(person.report().errors()).extracting(ValidationError::path)
                    .containsExactly("name", "gender", "age", "email", "address.zipcode");
        }

        @Test
        @DisplayName("directory parsing loads every YAML file in name order")
        void directory() throws Exception {
            List<SchemaEntry> entries = parser.parseDirectory(definitions());

            assertThat(entries).extracting(SchemaEntry::typeName).containsExactly("Article", "Address", "Person");
            assertThat(registry.typeNames()).containsExactly("Address", "Article", "Person");
        }

        @Test
        @DisplayName("inline YAML text is accepted with a caller-supplied source label")
        void inlineYaml() {
            parser.parse("""
                    type: Tag
                    fields:
                      - name: label
                        type: str
                        rules: [required, toupper, {oneof: [A, B]}]
                    """, "inline");

            assertThat(registry.lookup("Tag").create(Map.of("label", "a")).isValid()).isTrue();
            assertThat(registry.lookup("Tag").source()).isEqualTo("inline");
        }

        @Test
        @DisplayName("date and datetime defaults written as ISO text fill as temporal values")
        void temporalDefaults() {
            parser.parse("""
                    type: Booking
                    fields:
                      - name: day
                        type: date
                        rules: [{default: '2024-01-01'}]
                      - name: starts
                        type: datetime
                        rules: [required, {default: '2024-01-01T09:30:00Z'}]
                    """, "inline");

            JsonRecord booking = registry.lookup("Booking").create();

            assertThat(booking.get("day")).isEqualTo(LocalDate.of(2024, 1, 1));
            assertThat(booking.get("starts")).isEqualTo(Instant.parse("2024-01-01T09:30:00Z"));
            assertThat(booking.report().isEmpty()).isTrue();
            assertThat(booking.toJsonString()).isEqualTo("{\"day\":\"2024-01-01\",\"starts\":\"2024-01-01T09:30:00Z\"}");
        }
    }

    @Nested
    @DisplayName("invalid definitions")
    class InvalidDefinitions {

        @Test
        @DisplayName("unknown keys are rejected with the recognized set")
        void unknownKey() throws IOException {
            Path file = write("typo.yaml", """
                    type: Article
                    fields:
                      - name: title
                        type: string
                        rule: [required]
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Unknown key in field 'title': [rule]")
                    .satisfies(e -> assertThat(((SchemaDefinitionException) e).source()).isEqualTo(file.toString()));
            assertThat(registry.contains("Article")).isFalse();
        }

        @Test
        @DisplayName("unknown rules are rejected")
        void unknownRule() throws IOException {
            Path file = write("rule.yaml", """
                    type: Article
                    fields:
                      - name: title
                        type: string
                        rules: [requried]
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessage("Article.title: unknown rule 'requried'");
        }

        @Test
        @DisplayName("rules incompatible with the field type fail with file context")
        void incompatibleRule() throws IOException {
            Path file = write("incompatible.yaml", """
                    type: Counter
                    fields:
                      - name: count
                        type: integer
                        rules: [{maxlength: 3}]
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(IncompatibleOperatorException.class)
                    .hasMessageStartingWith("Counter.count: ")
                    .satisfies(e -> {
                        IncompatibleOperatorException ex = (IncompatibleOperatorException) e;
                        assertThat(ex.typeName()).isEqualTo("Counter");
                        assertThat(ex.source()).isEqualTo(file.toString());
                    });
        }

        @Test
        @DisplayName("option values outside the allowed set fail schema validation")
        void badOption() throws IOException {
            Path file = write("option.yaml", """
                    type: Article
                    options:
                      extra-fields: sometimes
                    fields: []
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("does not match the definition schema");
        }

        @Test
        @DisplayName("list fields require an item chain")
        void listWithoutItems() throws IOException {
            Path file = write("list.yaml", """
                    type: Tagged
                    fields:
                      - name: tags
                        type: list
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessage("Tagged.tags: type 'list' requires 'items'");
        }

        @Test
        @DisplayName("malformed YAML is reported as a parse error")
        void malformedYaml() throws IOException {
            Path file = write("broken.yaml", "type: [unclosed\n");

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageStartingWith("Failed to read or parse YAML");
        }

        @Test
        @DisplayName("a type defined in two files fails on the second")
        void duplicateAcrossFiles() throws IOException {
            String yaml = """
                    type: Tag
                    fields:
                      - name: label
                        type: string
                    """;
            parser.parse(write("a.yaml", yaml));
            Path second = write("b.yaml", yaml);

            assertThatThrownBy(() -> parser.parse(second))
                    .isInstanceOf(DuplicateSchemaException.class)
                    .satisfies(e -> assertThat(((DuplicateSchemaException) e).source()).isEqualTo(second.toString()))
                    .hasMessageContaining("from " + tempDir.resolve("a.yaml"));
        }

        @Test
        @DisplayName("a bad type in a types list leaves the earlier types unregistered")
        void failedDocumentRegistersNothing() throws IOException {
            Path file = write("people.yaml", """
                    types:
                      - type: Address
                        fields:
                          - name: city
                            type: string
                      - type: Person
                        fields:
                          - name: age
                            type: integer
                            rules: [{maxlength: 3}]
                    """);

            assertThatThrownBy(() -> parser.parse(file)).isInstanceOf(IncompatibleOperatorException.class);
            assertThat(registry.contains("Address")).isFalse();
            assertThat(registry.size()).isZero();

            Files.writeString(file, """
                    types:
                      - type: Address
                        fields:
                          - name: city
                            type: string
                      - type: Person
                        fields:
                          - name: age
                            type: integer
                            rules: [{max: 150}]
                    """);
            assertThat(parser.parse(file)).extracting(SchemaEntry::typeName).containsExactly("Address", "Person");
        }

        @Test
        @DisplayName("a type declared twice in one file fails before either is registered")
        void duplicateWithinFile() {
            assertThatThrownBy(() -> parser.parse("""
                    types:
                      - type: Tag
                        fields:
                          - name: label
                            type: string
                      - type: Tag
                        fields:
                          - name: name
                            type: string
                    """, "inline"))
                    .isInstanceOf(DuplicateSchemaException.class)
                    .hasMessage("Record type 'Tag' is declared more than once in inline");
            assertThat(registry.contains("Tag")).isFalse();
        }

        @Test
        @DisplayName("a duplicate field in a later type leaves the earlier types unregistered")
        void duplicateFieldRegistersNothing() {
            assertThatThrownBy(() -> parser.parse("""
                    types:
                      - type: Address
                        fields:
                          - name: city
                            type: string
                      - type: Person
                        fields:
                          - name: name
                            type: string
                          - name: name
                            type: integer
                    """, "inline"))
                    .isInstanceOf(DuplicateFieldException.class)
                    .hasMessage("Person: duplicate field 'name'");
            assertThat(registry.typeNames()).isEmpty();
        }

        @Test
        @DisplayName("parseDirectory rejects a plain file")
        void notADirectory() throws IOException {
            Path file = write("a.yaml", "type: X\nfields: []\n");

            assertThatThrownBy(() -> parser.parseDirectory(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageStartingWith("Not a directory");
        }
    }
}
