package com.jeffdisher.tessera.world;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;


/**
 * The in-memory store of loaded assets, keyed by their global id.
 * Not thread-safe:  only the kernel thread touches it.
 */
public class AssetRegistry
{
	private final Map<String, AssetState> _assets = new TreeMap<>();

	public AssetState get(String assetId)
	{
		return _assets.get(assetId);
	}

	public boolean contains(String assetId)
	{
		return _assets.containsKey(assetId);
	}

	/**
	 * @return The previous state of the asset, or null if it is new.
	 */
	public AssetState put(AssetState state)
	{
		return _assets.put(state.id(), state);
	}

	public AssetState remove(String assetId)
	{
		return _assets.remove(assetId);
	}

	/**
	 * @return All assets, ordered by id.
	 */
	public List<AssetState> all()
	{
		return new ArrayList<>(_assets.values());
	}

	public int count()
	{
		return _assets.size();
	}
}
