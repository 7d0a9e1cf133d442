package com.jeffdisher.tessera.namespaces;

import java.util.Set;


/**
 * Makes one entity visible to other namespaces.
 * An empty readable set means every component is readable.  Writes are only possible for the components in
 * writable, with ALL_COMPONENTS also permitting structural (hierarchy) changes to the entity.
 */
public record EntityExport(long localId
		, Set<String> readable
		, Set<String> writable
		, ExportAccess access
)
{
	public static final String ALL_COMPONENTS = "*";

	public static EntityExport readOnly(long localId, ExportAccess access)
	{
		return new EntityExport(localId, Set.of(), Set.of(), access);
	}

	public EntityExport
	{
		readable = Set.copyOf(readable);
		writable = Set.copyOf(writable);
	}

	public boolean canRead(String component)
	{
		return this.readable.isEmpty() || this.readable.contains(component) || this.readable.contains(ALL_COMPONENTS);
	}

	public boolean canWrite(String component)
	{
		return this.writable.contains(component) || this.writable.contains(ALL_COMPONENTS);
	}
}
