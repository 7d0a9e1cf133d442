package com.jeffdisher.tessera.patches;

import com.jeffdisher.tessera.types.EntityRef;
import com.jeffdisher.tessera.types.Value;


/**
 * Loads, unloads or replaces the data of an asset.  The asset type on LOAD is optional.
 */
public record AssetPatch(String assetId
		, Op op
		, String path
		, String assetType
		, Value data
) implements IPatchKind
{
	public enum Op
	{
		LOAD,
		UNLOAD,
		UPDATE,
	}

	public static AssetPatch load(String assetId, String path, String assetType)
	{
		return new AssetPatch(assetId, Op.LOAD, path, assetType, null);
	}

	public static AssetPatch unload(String assetId)
	{
		return new AssetPatch(assetId, Op.UNLOAD, null, null, null);
	}

	public static AssetPatch update(String assetId, Value data)
	{
		return new AssetPatch(assetId, Op.UPDATE, null, null, data);
	}

	@Override
	public PatchType getType()
	{
		return PatchType.ASSET;
	}

	@Override
	public EntityRef targetEntity()
	{
		return null;
	}
}
