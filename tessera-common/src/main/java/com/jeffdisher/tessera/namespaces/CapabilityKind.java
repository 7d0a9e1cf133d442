package com.jeffdisher.tessera.namespaces;


/**
 * The operations which require an explicit grant.
 */
public enum CapabilityKind
{
	/**
	 * Create entities in the holder's own namespace (the grant's max, if set, bounds how many it may own).
	 */
	CREATE_ENTITIES,
	DESTROY_ENTITIES,
	/**
	 * Write components (scope:  component names, empty for all).
	 */
	MODIFY_COMPONENTS,
	/**
	 * Create layers (the grant's max, if set, bounds how many it may own).
	 */
	CREATE_LAYERS,
	/**
	 * Update or destroy layers owned by another namespace (scope:  layer ids, empty for all).
	 */
	MODIFY_LAYERS,
	/**
	 * Load assets (scope:  path prefixes, empty for any path).
	 */
	LOAD_ASSETS,
	/**
	 * Read entities in other namespaces (namespaces:  the readable namespaces, empty for all).
	 */
	CROSS_NAMESPACE_READ,
	HOT_SWAP,
	/**
	 * Grant and revoke capabilities for other namespaces.
	 */
	MANAGE_CAPABILITIES,
	/**
	 * Satisfies every check.
	 */
	KERNEL_ADMIN,
}
