package com.jeffdisher.tessera.types;


/**
 * Refers to an entity by the namespace which owns it and a local id which is only unique within that namespace.
 */
public record EntityRef(NamespaceId namespace, long localId)
{
	public static EntityRef of(NamespaceId namespace, long localId)
	{
		return new EntityRef(namespace, localId);
	}

	@Override
	public String toString()
	{
		return this.namespace + "/" + this.localId;
	}
}
