/**
 * Value types exchanged with callers of the factorization engine.
 *
 * <p>All types are immutable records that validate their invariants on construction.
 *
 * @since 1.0
 */
package com.phillippitts.hybridfactor.domain;
