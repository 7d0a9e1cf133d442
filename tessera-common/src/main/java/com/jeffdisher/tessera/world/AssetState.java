package com.jeffdisher.tessera.world;

import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.Value;


/**
 * A loaded asset.  data is null until the first UPDATE and version counts the updates.
 */
public record AssetState(String id
		, NamespaceId owner
		, String path
		, String assetType
		, Value data
		, long version
)
{
	public AssetState withData(Value data)
	{
		return new AssetState(this.id, this.owner, this.path, this.assetType, data, this.version + 1L);
	}
}
