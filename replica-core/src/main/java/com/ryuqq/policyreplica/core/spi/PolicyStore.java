package com.ryuqq.policyreplica.core.spi;

import com.ryuqq.policyreplica.core.codec.WireRecord;
import com.ryuqq.policyreplica.core.exception.StoreException;

import java.util.List;

/**
 * Durable policy storage SPI.
 *
 * <p>The store owns durable truth. The replication core depends on it only through these
 * four operations; any backend offering them with the delivery guarantees below is valid.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Full, unordered snapshot of current state (cold start)</li>
 *   <li>Create by id and delete by id (write-through)</li>
 *   <li>Subscribable change stream carrying one {@link ChangeEvent} per committed write</li>
 * </ul>
 *
 * <p><strong>Persisted Record Shape:</strong></p>
 * <pre>
 * id           string
 * description  string
 * subjects     sequence of string
 * effect       string
 * resources    sequence of string
 * actions      sequence of string
 * conditions   opaque payload (absent/empty means "no conditions")
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods callable from multiple threads</li>
 *   <li>Per-id commit order on the change stream</li>
 *   <li>Failures surface as {@link StoreException}</li>
 * </ul>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public interface PolicyStore {

    /**
     * Returns every record currently stored, in no particular order.
     *
     * @return snapshot of all records (may be empty)
     * @throws StoreException if the store cannot be read
     */
    List<WireRecord> scanAll();

    /**
     * Creates a record.
     *
     * <p>Duplicate ids are a store-level concern and are not handled by the core.</p>
     *
     * @param record the record to create
     * @throws IllegalArgumentException if record is null
     * @throws StoreException if the write fails
     */
    void insert(WireRecord record);

    /**
     * Deletes the record with the given id.
     *
     * <p>Deleting an id that does not exist is not an error.</p>
     *
     * @param id the record id
     * @throws IllegalArgumentException if id is null
     * @throws StoreException if the write fails
     */
    void deleteById(String id);

    /**
     * Opens a new subscription to the change stream.
     *
     * @return a live subscription
     * @throws StoreException if the subscription cannot be opened
     */
    ChangeSubscription subscribeChanges();
}
