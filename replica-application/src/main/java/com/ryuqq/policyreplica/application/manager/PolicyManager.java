package com.ryuqq.policyreplica.application.manager;

import com.ryuqq.policyreplica.application.runtime.WatchHandle;
import com.ryuqq.policyreplica.core.exception.PolicyDecodeException;
import com.ryuqq.policyreplica.core.exception.PolicyEncodeException;
import com.ryuqq.policyreplica.core.exception.PolicyMatchException;
import com.ryuqq.policyreplica.core.exception.PolicyNotFoundException;
import com.ryuqq.policyreplica.core.exception.StoreException;
import com.ryuqq.policyreplica.core.model.AccessRequest;
import com.ryuqq.policyreplica.core.model.Policy;

import java.util.List;
import java.util.Optional;

/**
 * Replicated Policy Manager facade.
 *
 * <p>This interface is the only entry point other subsystems use. It orchestrates bootstrap,
 * write-through mutation and lookups over an in-memory replica of the durable policy store.</p>
 *
 * <p><strong>Consistency Model (write-then-wait-for-feed):</strong></p>
 * <pre>
 * create/update/delete ──► PolicyStore (durable)
 *                              │ change stream
 *                              ▼
 *                       Change Feed Consumer ──► Replica Cache ◄── get / find*
 * </pre>
 * <ul>
 *   <li>Writes go to the store only; the replica is updated once the change event arrives</li>
 *   <li>Callers must not assume read-your-writes</li>
 *   <li>Reads are served strictly from the replica</li>
 * </ul>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * manager.coldStart();              // populate replica from a full scan
 * WatchHandle handle = manager.watch(); // keep it current in the background
 * ...
 * manager.close();                  // cancel the consumer
 * </pre>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public interface PolicyManager extends AutoCloseable {

    /**
     * Rebuilds the replica from a full store scan.
     *
     * <p>Fail-closed: if any record cannot be decoded the whole bootstrap is aborted and the
     * replica keeps its previous content.</p>
     *
     * @throws StoreException if the scan fails
     * @throws PolicyDecodeException if any record cannot be decoded
     */
    void coldStart();

    /**
     * Writes a new policy to the store.
     *
     * <p>Does not touch the replica. The policy becomes visible to readers only after the
     * consumer applies the corresponding insert event.</p>
     *
     * @param policy the policy to create
     * @throws IllegalArgumentException if policy is null
     * @throws PolicyEncodeException if a condition cannot be serialized
     * @throws StoreException if the store write fails
     */
    void create(Policy policy);

    /**
     * Replaces a stored policy, modeled as delete-then-insert of the same id.
     *
     * <p>Same visibility delay as {@link #create(Policy)}. If the insert fails after the
     * delete succeeded, the replica's copy of the policy is re-inserted before the failure
     * is rethrown.</p>
     *
     * @param policy the new version of the policy
     * @throws IllegalArgumentException if policy is null
     * @throws PolicyEncodeException if a condition cannot be serialized
     * @throws StoreException if either store write fails
     */
    void update(Policy policy);

    /**
     * Deletes a policy from the store.
     *
     * <p>Same visibility delay as {@link #create(Policy)}.</p>
     *
     * @param id the policy id
     * @throws IllegalArgumentException if id is null
     * @throws StoreException if the store write fails
     */
    void delete(String id);

    /**
     * Returns a policy from the replica.
     *
     * @param id the policy id
     * @return the policy
     * @throws PolicyNotFoundException if the replica has no policy with this id
     */
    Policy get(String id);

    /**
     * Returns a policy from the replica, if present.
     *
     * @param id the policy id
     * @return the policy or empty
     */
    Optional<Policy> find(String id);

    /**
     * Returns a page of the replica ordered by id.
     *
     * @param limit maximum number of policies (positive)
     * @param offset number of policies to skip (zero or positive)
     * @return the page (may be empty)
     * @throws IllegalArgumentException if limit is not positive or offset is negative
     */
    List<Policy> getAll(int limit, int offset);

    /**
     * Finds every policy whose subject patterns match the subject.
     *
     * <p>Fail-fast: if the matcher fails for any policy the whole search is aborted, even if
     * earlier policies matched. Result order is unspecified.</p>
     *
     * @param subject the subject to look up
     * @return matching policies (empty if none match)
     * @throws PolicyMatchException if the matcher fails for any policy
     */
    List<Policy> findPoliciesForSubject(String subject);

    /**
     * Finds the candidate policies for a request, i.e. the policies matching its subject.
     *
     * @param request the access request
     * @return candidate policies
     * @throws PolicyMatchException if the matcher fails for any policy
     */
    List<Policy> findRequestCandidates(AccessRequest request);

    /**
     * Starts the change feed consumer.
     *
     * <p>The initial subscription is opened synchronously; once it succeeds the consumer runs in
     * the background and this method returns. Stream errors afterwards are logged and retried,
     * never propagated.</p>
     *
     * @return handle to observe and cancel the consumer
     * @throws StoreException if the initial subscription fails
     * @throws IllegalStateException if a consumer started by this manager is still running
     */
    WatchHandle watch();

    /**
     * Cancels the running consumer, if any.
     */
    @Override
    void close();
}
