package io.github.cyfko.boolexpr.tests;

import io.github.cyfko.boolexpr.BoolExpr;
import io.github.cyfko.boolexpr.core.api.ParserFlavor;
import io.github.cyfko.boolexpr.core.ast.Expression;
import io.github.cyfko.boolexpr.core.config.FilterConfig;
import io.github.cyfko.boolexpr.core.config.StringCaseStrategy;
import io.github.cyfko.boolexpr.core.exception.FieldNotFoundException;
import io.github.cyfko.boolexpr.core.exception.ValueTypeException;
import io.github.cyfko.boolexpr.jpa.CriteriaScope;
import io.github.cyfko.boolexpr.jpa.JpaFilterContext;
import io.github.cyfko.boolexpr.jpa.spi.PredicateResolver;
import io.github.cyfko.boolexpr.tests.entities.ModelA;
import io.github.cyfko.boolexpr.tests.entities.ModelB;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Root;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lowers parsed expressions against an in-memory H2 database and checks the matched rows.
 */
@DisplayName("JpaFilterContext against H2")
class JpaFilterContextTest {

    private static EntityManagerFactory emf;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");

        EntityManager em = emf.createEntityManager();
        try {
            em.getTransaction().begin();
            ModelB b1 = new ModelB(1L, 1.0);
            ModelB b2 = new ModelB(2L, 2.0);
            em.persist(b1);
            em.persist(b2);

            em.persist(new ModelA(1L, "Alpha", 1, 1)
                    .dates(LocalDate.of(2024, 1, 10)).y(10).active(true)
                    .createdAt(LocalDateTime.of(2024, 1, 10, 8, 0)).score(1.5).price(new BigDecimal("10.00")).ratio(0.5f).views(100L)
                    .tags("red", "blue").owner(b1));
            em.persist(new ModelA(2L, "Beta", 6, 2)
                    .nulls("set").dates(LocalDate.of(2024, 2, 15)).y(20).active(false)
                    .createdAt(LocalDateTime.of(2024, 2, 15, 12, 30)).score(2.5).price(new BigDecimal("20.50")).ratio(1.25f).views(3_000_000_000L)
                    .tags("green").owner(b2));
            em.persist(new ModelA(3L, "Gamma_ray", 8, 3)
                    .dates(LocalDate.of(2024, 3, 20)).y(30).active(true)
                    .createdAt(LocalDateTime.of(2024, 3, 20, 18, 45)).score(3.5).price(new BigDecimal("30.00")).ratio(2.0f).views(42L)
                    .tags("red").owner(b2));
            em.persist(new ModelA(4L, "delta", 12, 64)
                    .nulls("set").dates(LocalDate.of(2024, 4, 25)).y(40)
                    .createdAt(LocalDateTime.of(2024, 4, 25, 23, 59)).score(4.5).price(new BigDecimal("40.75")));
            em.persist(new ModelA(5L, "Theta", 5, 65)
                    .y(50).active(false).ratio(3.75f).views(7L)
                    .tags("blue").owner(b1));
            em.getTransaction().commit();
        } finally {
            em.close();
        }
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    private static JpaFilterContext context(FilterConfig config) {
        return new JpaFilterContext(emf.getMetamodel(), config);
    }

    private static Set<Long> ids(String expression) {
        return ids(FilterConfig.defaults(), BoolExpr.parse(expression).root());
    }

    private static Set<Long> ids(FilterConfig config, Expression expression) {
        PredicateResolver<ModelA> resolver = context(config).toResolver(expression);
        EntityManager em = emf.createEntityManager();
        try {
            CriteriaBuilder cb = em.getCriteriaBuilder();
            CriteriaQuery<ModelA> query = cb.createQuery(ModelA.class);
            Root<ModelA> root = query.from(ModelA.class);
            query.where(resolver.resolve(root, query, cb));
            return em.createQuery(query).getResultList().stream().map(ModelA::getId).collect(Collectors.toSet());
        } finally {
            em.close();
        }
    }

    /** Runs a query whose sources are built by {@code sources} from the ModelA root. */
    private static Set<Long> idsWithSources(String expression, Function<Root<ModelA>, List<From<?, ?>>> sources) {
        JpaFilterContext context = context(FilterConfig.defaults());
        EntityManager em = emf.createEntityManager();
        try {
            CriteriaBuilder cb = em.getCriteriaBuilder();
            CriteriaQuery<ModelA> query = cb.createQuery(ModelA.class);
            Root<ModelA> root = query.from(ModelA.class);
            query.select(root).where(context.filter(BoolExpr.parse(expression).root(),
                    new CriteriaScope(cb, query, sources.apply(root))));
            return em.createQuery(query).getResultList().stream().map(ModelA::getId).collect(Collectors.toSet());
        } finally {
            em.close();
        }
    }

    @Nested
    @DisplayName("Numeric fields")
    class NumericFields {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = ';', value = {
                "modela.x > 5; 2 3 4",
                "modela.x >= 6 and modela.x < 12; 2 3",
                "modela.x == 5; 5",
                "modela.x = 5; 5",
                "modela.x != 5; 1 2 3 4",
                "modela.x <= 5; 1 5",
                "modela.x between 5 and 8; 2 3 5",
                "modela.x < 5 or modela.x > 10; 1 4",
                "not modela.x > 5; 1 5",
                "x > 5; 2 3 4",
                "modela.score between 2 and 4; 2 3",
                "modela.price > 20.5; 3 4",
                "modela.price == 10; 1",
                "modela.ratio > 1.5; 3 5",
                "modela.ratio between 0.5 and 1.25; 1 2",
                "modela.ratio == 2; 3",
                "modela.views > 2147483647; 2",
                "modela.views == 42; 3",
                "modela.views <= 100; 1 3 5"
        })
        void comparisons(String expression, String expected) {
            assertEquals(parseIds(expected), ids(expression));
        }

        @Test
        void equalityIsExactNotFuzzy() {
            assertEquals(Set.of(5L), ids("modela.x == 5"));
            assertEquals(Set.of(), ids("modela.y = 5"));
        }

        @Test
        void nonNumericLiteral() {
            ValueTypeException ex = assertThrows(ValueTypeException.class, () -> ids("modela.x > five"));
            assertEquals("Field modela.x expects a INTEGER value. Received five instead.", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("String fields")
    class StringFields {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = ';', value = {
                "modela.name = ta; 2 4 5",
                "modela.name = a*; 1",
                "modela.name = *A; 1 2 4 5",
                "modela.name = *mm*; 3",
                "modela.name = _; 3",
                "modela.name == BETA; 2",
                "modela.name == bet; ''",
                "modela.name != beta; 1 3 4 5",
                "modela.name > delta; 3 5",
                "modela.name between b and e; 2 4",
                "modela.name == \"Gamma_ray\"; 3"
        })
        void caseInsensitiveByDefault(String expression, String expected) {
            assertEquals(parseIds(expected), ids(expression));
        }

        @Test
        void containsIsTheDefaultForEquals() {
            assertEquals(Set.of(2L, 4L, 5L), ids("modela.name = Ta"));
        }

        @Test
        void caseSensitiveStrategy() {
            FilterConfig exact = FilterConfig.builder().stringCaseStrategy(StringCaseStrategy.NONE).build();
            assertEquals(Set.of(), ids(exact, BoolExpr.parse("modela.name == beta").root()));
            assertEquals(Set.of(2L), ids(exact, BoolExpr.parse("modela.name == Beta").root()));
        }

        @Test
        void upperCaseStrategy() {
            FilterConfig upper = FilterConfig.builder().stringCaseStrategy(StringCaseStrategy.UPPER).build();
            assertEquals(Set.of(3L), ids(upper, BoolExpr.parse("modela.name = gamma*").root()));
        }

        @Test
        void bitwiseOnStringFails() {
            assertThrows(ValueTypeException.class, () -> ids("modela.name & 4"));
        }
    }

    @Nested
    @DisplayName("Null literal")
    class NullLiteral {

        @Test
        void isNull() {
            assertEquals(Set.of(1L, 3L, 5L), ids("modela.nulls = null"));
            assertEquals(Set.of(1L, 3L, 5L), ids("modela.nulls == NULL"));
        }

        @Test
        void isNotNull() {
            assertEquals(Set.of(2L, 4L), ids("modela.nulls != null"));
        }

        @Test
        void columnNameResolvesToo() {
            assertEquals(Set.of(2L, 4L), ids("modela.nullable_value != null"));
        }

        @Test
        void nonStringFields() {
            assertEquals(Set.of(5L), ids("modela.dates = null"));
            assertEquals(Set.of(4L), ids("modela.active == null"));
        }

        @Test
        void otherOperatorsCoerceTheLiteral() {
            assertThrows(ValueTypeException.class, () -> ids("modela.x > null"));
        }
    }

    @Nested
    @DisplayName("Bitwise masks")
    class Bitwise {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = ';', value = {
                "modela.flags & 64; 4 5",
                "modela.flags & 2; 2 3",
                "modela.flags & 1; 1 3 5",
                "modela.flags & ~64; 1 2 3 5",
                "modela.flags & 128; ''"
        })
        void anyOverlap(String expression, String expected) {
            assertEquals(parseIds(expected), ids(expression));
        }
    }

    @Nested
    @DisplayName("Booleans and dates")
    class TypedFields {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = ';', value = {
                "modela.active == true; 1 3",
                "modela.active = yes; 1 3",
                "modela.active == f; 2 5",
                "modela.active != 0; 1 3",
                "modela.dates > 2024-02-15; 3 4",
                "modela.dates == \"2024-03-20T10:00:00\"; 3",
                "modela.dates between 2024-01-01 and 2024-02-28; 1 2",
                "modela.createdAt >= \"2024-03-01T00:00:00\"; 3 4",
                "modela.createdAt < 2024-02-01; 1",
                "modela.createdAt > \"2024-02-15 12:00\"; 2 3 4"
        })
        void coercedComparisons(String expression, String expected) {
            assertEquals(parseIds(expected), ids(expression));
        }

        @Test
        void unparsableBoolean() {
            assertThrows(ValueTypeException.class, () -> ids("modela.active == maybe"));
        }

        @Test
        void unparsableDate() {
            ValueTypeException ex = assertThrows(ValueTypeException.class, () -> ids("modela.dates > yesterday"));
            assertEquals("yesterday", ex.getLiteral());
        }
    }

    @Nested
    @DisplayName("Element collections")
    class ElementCollections {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = ';', value = {
                "modela.tags = red; 1 3",
                "modela.tags == BLUE; 1 5",
                "modela.tags = re*; 1 3",
                "modela.tags != red; 1 2 5",
                "modela.tags = null; 4",
                "modela.tags != null; 1 2 3 5",
                "not modela.tags == red; 2 4 5",
                "modela.tags == red and modela.tags == blue; 1"
        })
        void anyElementMatches(String expression, String expected) {
            assertEquals(parseIds(expected), ids(expression));
        }
    }

    @Nested
    @DisplayName("Bare words")
    class Words {

        @Test
        void booleanFieldIsTrue() {
            assertEquals(Set.of(1L, 3L), ids(FilterConfig.defaults(), BoolExpr.parse("modela.active", ParserFlavor.GENERIC).root()));
        }

        @Test
        void otherFieldIsNotNull() {
            assertEquals(Set.of(2L, 4L), ids(FilterConfig.defaults(), BoolExpr.parse("modela.nulls", ParserFlavor.GENERIC).root()));
        }

        @Test
        void collectionIsNotEmpty() {
            assertEquals(Set.of(1L, 2L, 3L, 5L), ids(FilterConfig.defaults(), BoolExpr.parse("modela.tags", ParserFlavor.GENERIC).root()));
        }

        @Test
        void combinedWithConditions() {
            assertEquals(Set.of(3L), ids(FilterConfig.defaults(),
                    BoolExpr.parse("active and x > 5", ParserFlavor.GENERIC).root()));
        }
    }

    @Nested
    @DisplayName("Field resolution")
    class Resolution {

        @Test
        void missingField() {
            FieldNotFoundException ex = assertThrows(FieldNotFoundException.class, () -> ids("modela.missingfield > 1"));
            assertEquals("modela.missingfield", ex.getField());
            assertTrue(ex.getMessage().contains("missingfield"));
            assertEquals(1, ex.getTriedSources().size());
            assertTrue(ex.getTriedSources().get(0).contains("ModelA"));
        }

        @Test
        void foreignBase() {
            assertThrows(FieldNotFoundException.class, () -> ids("modelb.x > 1"));
        }

        @Test
        void associationsAreNotComparable() {
            assertThrows(FieldNotFoundException.class, () -> ids("modela.owner > 1"));
        }

        @Test
        void entityNameAsBase() {
            assertEquals(Set.of(2L, 3L, 4L), ids("ModelA.x > 5"));
        }

        @Test
        void aliasedRoot() {
            assertEquals(Set.of(2L, 3L, 4L), idsWithSources("modela2.x > 5", root -> {
                root.alias("modela2");
                return List.of(root);
            }));
        }

        @Test
        void unknownAlias() {
            assertThrows(FieldNotFoundException.class, () -> idsWithSources("other.x > 5", List::of));
        }

        @Test
        void sourcesAreTriedInOrder() {
            Function<Root<ModelA>, List<From<?, ?>>> rootAndOwner = root -> {
                Join<ModelA, ModelB> owner = root.join("owner");
                return List.of(root, owner);
            };
            assertEquals(Set.of(2L, 3L), idsWithSources("modela.x > 5 and modelb.z > 1.5", rootAndOwner));
            assertEquals(Set.of(2L, 3L), idsWithSources("x > 5 and z > 1.5", rootAndOwner));
        }

        @Test
        void notFoundListsEverySource() {
            FieldNotFoundException ex = assertThrows(FieldNotFoundException.class,
                    () -> idsWithSources("w > 1", root -> List.of(root, root.join("owner"))));
            assertEquals(2, ex.getTriedSources().size());
            assertTrue(ex.getTriedSources().get(1).contains("ModelB"));
        }
    }

    private static Set<Long> parseIds(String expected) {
        if (expected == null || expected.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(expected.trim().split("\\s+")).map(Long::valueOf).collect(Collectors.toSet());
    }
}
