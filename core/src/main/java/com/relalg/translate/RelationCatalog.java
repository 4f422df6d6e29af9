package com.relalg.translate;

import com.relalg.ast.CodeInfo;
import com.relalg.exception.TranslationException;
import com.relalg.logical.Relation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The relations a query may reference, by name.
 *
 * <p>The catalog is only read during translation. Every lookup returns a fresh
 * {@link Relation#copy()}, so the trees built from it never alias catalog
 * entries or each other.
 */
public final class RelationCatalog {

    private final Map<String, Relation> relations;

    /**
     * Creates a catalog from a name to relation mapping.
     *
     * @param relations the relations by name
     */
    public RelationCatalog(Map<String, Relation> relations) {
        this.relations = new LinkedHashMap<>(Objects.requireNonNull(relations, "relations must not be null"));
    }

    /**
     * Creates a catalog keyed by the relations' own names.
     *
     * @param relations the relations
     * @return the catalog
     */
    public static RelationCatalog of(Relation... relations) {
        Map<String, Relation> byName = new LinkedHashMap<>();
        for (Relation relation : relations) {
            byName.put(relation.name(), relation);
        }
        return new RelationCatalog(byName);
    }

    public boolean contains(String name) {
        return relations.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(relations.keySet());
    }

    /**
     * Returns an independent copy of a relation.
     *
     * @param name the relation name
     * @param codeInfo the position of the reference, for the error
     * @return a copy of the relation
     * @throws TranslationException if no relation has that name
     */
    public Relation lookup(String name, CodeInfo codeInfo) {
        Relation relation = relations.get(name);
        if (relation == null) {
            throw new TranslationException(TranslatorConfig.ERROR_RELATION_NOT_FOUND, "name", name, codeInfo);
        }
        return relation.copy();
    }
}
