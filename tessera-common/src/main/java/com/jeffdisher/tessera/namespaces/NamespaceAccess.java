package com.jeffdisher.tessera.namespaces;


/**
 * The result of an access check against an entity in another namespace.
 */
public enum NamespaceAccess
{
	ALLOWED,
	/**
	 * The entity is exported, but not to the requester (or not writable, for a write).
	 */
	DENIED_NOT_OWNER,
	/**
	 * The entity isn't exported and the requester holds no capability granting access.
	 */
	DENIED_MISSING_CAPABILITY,
	/**
	 * The target namespace doesn't exist.
	 */
	DENIED_NOT_FOUND,
	;

	public boolean isAllowed()
	{
		return ALLOWED == this;
	}
}
