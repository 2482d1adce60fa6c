package com.fhi.fixture_isolation.store;

import java.util.Map;
import java.util.Optional;

import org.hibernate.Hibernate;
import org.springframework.beans.PropertyAccessorFactory;
import org.springframework.orm.jpa.SharedEntityManagerCreator;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.fhi.fixture_isolation.copy.FixtureCopier;
import com.fhi.fixture_isolation.copy.ReflectiveFixtureCopier;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityNotFoundException;
import jakarta.persistence.PersistenceUnitUtil;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaUpdate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.SingularAttribute;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link FixtureStore} over a JPA persistence unit.
 *
 * <p>Every operation runs in its own transaction, or joins the surrounding one (e.g. the
 * transaction of a {@code @Transactional} test). Objects handed out are detached deep copies,
 * never the managed instances of the persistence context.</p>
 */
@Slf4j
public class JpaFixtureStore implements FixtureStore
{
    private final EntityManagerFactory entityManagerFactory;
    private final EntityManager entityManager;
    private final TransactionTemplate transactionTemplate;
    private final FixtureCopier copier;

    public JpaFixtureStore(EntityManagerFactory entityManagerFactory, PlatformTransactionManager transactionManager)
    {
        this.entityManagerFactory = entityManagerFactory;
        this.entityManager = SharedEntityManagerCreator.createSharedEntityManager(entityManagerFactory);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.copier = persistenceAwareCopier();
        log.debug("JpaFixtureStore created for persistence unit with {} entity type(s)",
                  entityManagerFactory.getMetamodel().getEntities().size());
    }

    /**
     * Reflective copier that leaves uninitialised lazy associations alone and copies the
     * target of initialised proxies.
     */
    public static ReflectiveFixtureCopier persistenceAwareCopier()
    {   return new ReflectiveFixtureCopier(value -> !Hibernate.isInitialized(value), Hibernate::unproxy);
    }

    @Override
    public FixtureCopier fixtureCopier()
    {   return copier;
    }

    /**
     * Also accepts the class of a Hibernate proxy, as in {@code get(team.getClass(), id)} on a
     * lazily loaded association: the entity class it extends is looked up.
     */
    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(Class<T> type, Object id)
    {
        Class<T> entityClass = (Class<T>) entityClassOf(type);
        log.debug("get {}#{}", entityClass.getSimpleName(), id);
        return transactionTemplate.execute(status ->
        {   entityManager.flush();
            T entity = entityManager.find(entityClass, id);
            if (entity == null)
            {   throw new EntityNotFoundException(String.format("No %s stored with id %s", entityClass.getName(), id));
            }
            entityManager.refresh(entity);
            return copier.copy(entity);
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public void update(Class<?> type, Object id, Map<String, Object> fields)
    {
        Class<Object> entityType = (Class<Object>) entityClassOf(type);
        log.debug("update {}#{} with {}", entityType.getSimpleName(), id, fields.keySet());
        if (fields.isEmpty()) return;
        String idAttribute = idAttributeOf(entityType).getName();

        transactionTemplate.executeWithoutResult(status ->
        {   entityManager.flush();
            CriteriaBuilder cb = entityManager.getCriteriaBuilder();
            CriteriaUpdate<Object> update = cb.createCriteriaUpdate(entityType);
            Root<Object> root = update.from(entityType);
            fields.forEach(update::set);
            update.where(cb.equal(root.get(idAttribute), id));
            int rows = entityManager.createQuery(update).executeUpdate();
            if (rows == 0)
            {   log.warn("Update of {}#{} matched no stored row", entityType.getSimpleName(), id);
            }
        });
    }

    @Override
    public Object insert(Object entity)
    {
        log.debug("insert {}", entity.getClass().getSimpleName());
        return transactionTemplate.execute(status ->
        {   entityManager.persist(entity);
            entityManager.flush();
            Object id = persistenceUnitUtil().getIdentifier(entity);
            entityManager.detach(entity);
            return id;
        });
    }

    @Override
    public Optional<Object> identityOf(Object value)
    {
        if (value == null || !isEntity(Hibernate.getClass(value))) return Optional.empty();
        return Optional.ofNullable(persistenceUnitUtil().getIdentifier(value));
    }

    @Override
    public void clearIdentity(Object entity)
    {
        Class<?> type = Hibernate.getClass(entity);
        EntityType<?> entityType = entityManagerFactory.getMetamodel().entity(type);
        var direct = PropertyAccessorFactory.forDirectFieldAccess(entity);

        SingularAttribute<?, ?> id = idAttributeOf(type);
        direct.setPropertyValue(id.getName(), emptyValueOf(id.getJavaType()));
        if (entityType.hasVersionAttribute())
        {   for (SingularAttribute<?, ?> attribute : entityType.getSingularAttributes())
            {   if (attribute.isVersion())
                {   direct.setPropertyValue(attribute.getName(), emptyValueOf(attribute.getJavaType()));
                }
            }
        }
    }

    // =====================================================================
    // Metamodel helpers
    // =====================================================================

    private boolean isEntity(Class<?> type)
    {
        try
        {   entityManagerFactory.getMetamodel().entity(type);
            return true;
        }
        catch (IllegalArgumentException e)
        {   return false;
        }
    }

    /**
     * The mapped entity class of {@code type} or of its closest mapped superclass (a proxy class
     * extends its entity); {@code type} itself when none is mapped.
     */
    private Class<?> entityClassOf(Class<?> type)
    {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass())
        {   if (isEntity(current)) return current;
        }
        return type;
    }

    private SingularAttribute<?, ?> idAttributeOf(Class<?> type)
    {
        EntityType<?> entityType = entityManagerFactory.getMetamodel().entity(type);
        if (!entityType.hasSingleIdAttribute())
        {   throw new IllegalArgumentException("Composite identifiers are not supported: " + type.getName());
        }
        for (SingularAttribute<?, ?> attribute : entityType.getSingularAttributes())
        {   if (attribute.isId()) return attribute;
        }
        throw new IllegalArgumentException("No identifier attribute on " + type.getName());
    }

    private PersistenceUnitUtil persistenceUnitUtil()
    {   return entityManagerFactory.getPersistenceUnitUtil();
    }

    private static Object emptyValueOf(Class<?> type)
    {
        if (!type.isPrimitive()) return null;
        if (type == boolean.class) return false;
        if (type == char.class) return '\0';
        return 0;
    }
}
