/**
 * Ownership-qualified handles returned by factory construction.
 *
 * <p>An abstract type picks its handle kind with {@link io.genfactory.handle.PreferredOwnership};
 * types without a declaration get {@link io.genfactory.handle.SharedHandle shared} handles.
 *
 * @see io.genfactory.handle.Handle
 * @see io.genfactory.handle.OwnershipPolicy
 */
package io.genfactory.handle;
