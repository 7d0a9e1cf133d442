package com.jeffdisher.tessera.world;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;


/**
 * The in-memory store of render layers, keyed by their global id.
 * Not thread-safe:  only the kernel thread touches it.
 */
public class LayerManager
{
	private final Map<String, LayerState> _layers = new TreeMap<>();

	public LayerState get(String layerId)
	{
		return _layers.get(layerId);
	}

	public boolean contains(String layerId)
	{
		return _layers.containsKey(layerId);
	}

	/**
	 * Inserts or overwrites a layer.
	 * 
	 * @return The previous state of the layer, or null if it is new.
	 */
	public LayerState put(LayerState state)
	{
		return _layers.put(state.id(), state);
	}

	public LayerState remove(String layerId)
	{
		return _layers.remove(layerId);
	}

	/**
	 * @return All layers, ordered by id.
	 */
	public List<LayerState> all()
	{
		return new ArrayList<>(_layers.values());
	}

	/**
	 * @return The visible layers from highest to lowest priority (ties by id).
	 */
	public List<LayerState> renderOrder()
	{
		List<LayerState> visible = new ArrayList<>();
		for (LayerState state : _layers.values())
		{
			if (state.visible())
			{
				visible.add(state);
			}
		}
		visible.sort((LayerState a, LayerState b) -> Integer.compare(b.priority(), a.priority()));
		return visible;
	}

	public int count()
	{
		return _layers.size();
	}
}
