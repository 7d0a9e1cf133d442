package com.jeffdisher.tessera.namespaces;

import com.jeffdisher.tessera.types.CapabilityId;
import com.jeffdisher.tessera.types.NamespaceId;


/**
 * A grant held by one namespace.
 */
public record Capability(CapabilityId id
		, NamespaceId holder
		, NamespaceId grantor
		, CapabilityGrant grant
)
{
	public CapabilityKind kind()
	{
		return this.grant.kind();
	}

	public boolean isExpired(long nowMillis)
	{
		long expiry = this.grant.expiresAtMillis();
		return (0L != expiry) && (nowMillis >= expiry);
	}

	/**
	 * A grant narrowed to a scope only covers named items within it, so an unscoped check (null scopeItem) needs an
	 * unscoped grant.
	 * 
	 * @param scopeItem The component name, layer id or asset path being checked (null if the check isn't scoped).
	 * @param target The namespace being read (null unless this is a cross-namespace read).
	 * @return True if this grant covers the given item and namespace.
	 */
	public boolean covers(String scopeItem, NamespaceId target)
	{
		boolean scopeMatches = this.grant.scope().isEmpty() || ((null != scopeItem) && _scopeContains(scopeItem));
		boolean namespaceMatches = (null == target) || this.grant.namespaces().isEmpty() || this.grant.namespaces().contains(target);
		return scopeMatches && namespaceMatches;
	}


	private boolean _scopeContains(String scopeItem)
	{
		boolean contains;
		if (CapabilityKind.LOAD_ASSETS == this.grant.kind())
		{
			// Asset scopes are path prefixes.
			contains = false;
			for (String prefix : this.grant.scope())
			{
				if (scopeItem.startsWith(prefix))
				{
					contains = true;
					break;
				}
			}
		}
		else
		{
			contains = this.grant.scope().contains(scopeItem);
		}
		return contains;
	}
}
