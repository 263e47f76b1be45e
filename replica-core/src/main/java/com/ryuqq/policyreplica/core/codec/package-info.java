/**
 * Policy ↔ Wire Record 변환.
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
package com.ryuqq.policyreplica.core.codec;
