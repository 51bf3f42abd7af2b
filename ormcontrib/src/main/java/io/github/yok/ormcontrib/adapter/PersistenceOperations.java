package io.github.yok.ormcontrib.adapter;

import io.github.yok.ormcontrib.adapter.model.Entity;
import io.github.yok.ormcontrib.adapter.model.EntityCollection;
import io.github.yok.ormcontrib.adapter.model.PredicateExpression;
import io.github.yok.ormcontrib.adapter.model.RelationPredicateBucket;

/**
 * Insert, update and delete operations.
 *
 * <p>
 * Operations touching more than one row start their own transaction when none is active on the
 * adapter.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface PersistenceOperations {

    /**
     * Saves (inserts or updates) an entity.
     *
     * @param entityToSave entity to persist
     * @param refetchAfterSave whether to re-read the entity after the save
     * @param updateRestriction concurrency predicate for the update, may be {@code null}
     * @param recurse whether to save related dirty entities as well
     * @return {@code true} if the save succeeded
     */
    boolean saveEntity(Entity entityToSave, boolean refetchAfterSave,
            PredicateExpression updateRestriction, boolean recurse);

    boolean saveEntity(Entity entityToSave, boolean refetchAfterSave,
            PredicateExpression updateRestriction);

    boolean saveEntity(Entity entityToSave, boolean refetchAfterSave, boolean recurse);

    boolean saveEntity(Entity entityToSave, boolean refetchAfterSave);

    boolean saveEntity(Entity entityToSave);

    /**
     * Saves every dirty entity in the collection.
     *
     * @param collectionToSave entities to persist
     * @param refetchSavedEntitiesAfterSave whether to re-read saved entities
     * @param recurse whether to save related dirty entities as well
     * @return number of persisted entities
     */
    int saveEntityCollection(EntityCollection<?> collectionToSave,
            boolean refetchSavedEntitiesAfterSave, boolean recurse);

    int saveEntityCollection(EntityCollection<?> collectionToSave);

    /**
     * Deletes an entity; the instance becomes out of sync afterwards.
     *
     * @param entityToDelete entity to delete
     * @param deleteRestriction concurrency predicate for the delete, may be {@code null}
     * @return {@code true} if the delete succeeded
     */
    boolean deleteEntity(Entity entityToDelete, PredicateExpression deleteRestriction);

    boolean deleteEntity(Entity entityToDelete);

    /**
     * Deletes every entity in the collection. Deleted entities stay in the collection.
     *
     * @param collectionToDelete entities to delete
     * @return number of deleted entities
     */
    int deleteEntityCollection(EntityCollection<?> collectionToDelete);

    /**
     * Deletes the rows of an entity type that match a filter, without fetching them first.
     *
     * @param entityType entity type whose persistence information is used
     * @param filterBucket filter selecting the rows to delete
     * @return number of deleted rows
     */
    int deleteEntitiesDirectly(Class<? extends Entity> entityType,
            RelationPredicateBucket filterBucket);

    /**
     * Deletes the rows of an entity type, identified by its name (e.g. {@code "CustomerEntity"}),
     * that match a filter.
     *
     * @param entityName entity name
     * @param filterBucket filter selecting the rows to delete
     * @return number of deleted rows
     */
    int deleteEntitiesDirectly(String entityName, RelationPredicateBucket filterBucket);

    /**
     * Updates the matching rows with the changed field values of {@code entityWithNewValues}.
     *
     * @param entityWithNewValues entity carrying the new values; only changed fields are written
     * @param filterBucket filter selecting the rows to update
     * @return number of updated rows
     */
    int updateEntitiesDirectly(Entity entityWithNewValues, RelationPredicateBucket filterBucket);
}
