package io.github.cyfko.boolexpr.jpa;

import io.github.cyfko.boolexpr.core.api.ValueDomain;
import io.github.cyfko.boolexpr.core.ast.ParameterName;
import io.github.cyfko.boolexpr.core.spi.FieldResolver;
import jakarta.persistence.Column;
import jakarta.persistence.Table;
import jakarta.persistence.criteria.From;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.ManagedType;
import jakarta.persistence.metamodel.Metamodel;
import jakarta.persistence.metamodel.PluralAttribute;
import jakarta.persistence.metamodel.SingularAttribute;
import jakarta.persistence.metamodel.Type;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Member;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves parameters against the JPA {@link Metamodel}.
 *
 * <h2>Base matching</h2>
 * <p>
 * A dotted parameter {@code base.name} only resolves on a source whose alias, {@code @Table}
 * name, entity name or class simple name equals {@code base}, ignoring case. An undotted
 * parameter may resolve on any source.
 * </p>
 *
 * <h2>Name matching</h2>
 * <p>
 * {@code name} is first looked up as a persistent attribute name, then as a {@code @Column}
 * name, ignoring case.
 * </p>
 *
 * <h2>Comparable fields</h2>
 * <ul>
 *   <li>basic singular attributes</li>
 *   <li>element collections of basic values, flagged as collections</li>
 * </ul>
 * Associations and embeddables never resolve.
 *
 * @since 1.0.0
 */
public class MetamodelFieldResolver implements FieldResolver<From<?, ?>, FieldHandle> {

    private static final Logger logger = Logger.getLogger(MetamodelFieldResolver.class.getName());

    private final Metamodel metamodel;

    public MetamodelFieldResolver(Metamodel metamodel) {
        this.metamodel = Objects.requireNonNull(metamodel, "metamodel cannot be null");
    }

    @Override
    public Optional<FieldHandle> resolve(ParameterName parameter, From<?, ?> source) {
        ManagedType<?> managedType = managedType(source);
        if (managedType == null) {
            return Optional.empty();
        }
        if (parameter.hasBase() && !matchesBase(parameter.base(), source, managedType)) {
            return Optional.empty();
        }
        return findAttribute(managedType, parameter.name()).flatMap(attribute -> toHandle(source, attribute));
    }

    @Override
    public String describe(From<?, ?> source) {
        ManagedType<?> managedType = managedType(source);
        String name = managedType instanceof EntityType<?> entityType
                ? entityType.getName()
                : source.getJavaType().getSimpleName();
        return source.getAlias() != null ? name + " (" + source.getAlias() + ")" : name;
    }

    private ManagedType<?> managedType(From<?, ?> source) {
        try {
            return metamodel.managedType(source.getJavaType());
        } catch (IllegalArgumentException e) {
            logger.fine(() -> "Not a managed type: " + source.getJavaType().getName());
            return null;
        }
    }

    private static boolean matchesBase(String base, From<?, ?> source, ManagedType<?> managedType) {
        if (base.equalsIgnoreCase(source.getAlias())) {
            return true;
        }
        Class<?> javaType = source.getJavaType();
        Table table = javaType.getAnnotation(Table.class);
        if (table != null && base.equalsIgnoreCase(table.name())) {
            return true;
        }
        if (managedType instanceof EntityType<?> entityType && base.equalsIgnoreCase(entityType.getName())) {
            return true;
        }
        return base.equalsIgnoreCase(javaType.getSimpleName());
    }

    private static Optional<Attribute<?, ?>> findAttribute(ManagedType<?> managedType, String name) {
        for (Attribute<?, ?> attribute : managedType.getAttributes()) {
            if (attribute.getName().equals(name)) {
                return Optional.of(attribute);
            }
        }
        for (Attribute<?, ?> attribute : managedType.getAttributes()) {
            if (attribute.getName().equalsIgnoreCase(name) || name.equalsIgnoreCase(columnName(attribute))) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    private static String columnName(Attribute<?, ?> attribute) {
        Member member = attribute.getJavaMember();
        if (member instanceof AnnotatedElement element) {
            Column column = element.getAnnotation(Column.class);
            if (column != null && !column.name().isEmpty()) {
                return column.name();
            }
        }
        return null;
    }

    private static Optional<FieldHandle> toHandle(From<?, ?> source, Attribute<?, ?> attribute) {
        if (attribute instanceof SingularAttribute<?, ?> singular
                && singular.getPersistentAttributeType() == Attribute.PersistentAttributeType.BASIC) {
            Class<?> javaType = singular.getJavaType();
            return Optional.of(new FieldHandle(source, attribute.getName(), javaType, ValueDomain.of(javaType), false));
        }
        if (attribute instanceof PluralAttribute<?, ?, ?> plural
                && plural.getPersistentAttributeType() == Attribute.PersistentAttributeType.ELEMENT_COLLECTION
                && plural.getElementType().getPersistenceType() == Type.PersistenceType.BASIC) {
            Class<?> elementType = plural.getElementType().getJavaType();
            return Optional.of(new FieldHandle(source, attribute.getName(), elementType, ValueDomain.of(elementType), true));
        }
        logger.fine(() -> "Attribute " + attribute.getName() + " is not comparable");
        return Optional.empty();
    }
}
