package com.jeffdisher.tessera.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;


/**
 * Callbacks for the common case of a flat key-value file:  every record has exactly one parameter and there are no
 * sub-records.
 * 
 * @param <K> The key type.
 * @param <V> The value type.
 */
public class FlatTabListCallbacks<K, V> implements TabListReader.IParseCallbacks
{
	private final IValueTransformer<K> _keyTransformer;
	private final IValueTransformer<V> _valueTransformer;
	public final List<K> keyOrder;
	public final Map<K, V> data;

	private K _currentKey;
	private V _currentValue;

	public FlatTabListCallbacks(IValueTransformer<K> keyTransformer, IValueTransformer<V> valueTransformer)
	{
		_keyTransformer = keyTransformer;
		_valueTransformer = valueTransformer;
		this.keyOrder = new ArrayList<>();
		this.data = new HashMap<>();
	}

	@Override
	public void startNewRecord(String name) throws TabListReader.TabListException
	{
		K key = _keyTransformer.transform(name);
		if (this.data.containsKey(key))
		{
			throw new TabListReader.TabListException("Duplicate data element: \"" + name + "\"");
		}
		_currentKey = key;
		_currentValue = null;
	}

	@Override
	public void handleParameter(String value) throws TabListReader.TabListException
	{
		if (null != _currentValue)
		{
			throw new TabListReader.TabListException("Exactly 1 parameter expected for \"" + _currentKey + "\"");
		}
		_currentValue = _valueTransformer.transform(value);
	}

	@Override
	public void endRecord() throws TabListReader.TabListException
	{
		if (null == _currentValue)
		{
			throw new TabListReader.TabListException("Missing value for \"" + _currentKey + "\"");
		}
		this.keyOrder.add(_currentKey);
		this.data.put(_currentKey, _currentValue);
		_currentKey = null;
		_currentValue = null;
	}

	@Override
	public void startSubRecord(String name) throws TabListReader.TabListException
	{
		throw new TabListReader.TabListException("Sub-records are not expected");
	}

	@Override
	public void endSubRecord() throws TabListReader.TabListException
	{
		throw new TabListReader.TabListException("Sub-records are not expected");
	}
}
