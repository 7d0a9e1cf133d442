package com.jeffdisher.tessera.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.jeffdisher.tessera.utils.Assert;


/**
 * An immutable, plain-data value used for component data, asset data, and the field maps of component updates.
 * Values are compared structurally so that snapshots can detect changes with equals().
 * Object fields are kept in key order so that the string form and iteration are stable.
 */
public final class Value
{
	public enum Type
	{
		NULL,
		BOOL,
		INT,
		FLOAT,
		STRING,
		ARRAY,
		OBJECT,
	}

	public static final Value NULL = new Value(Type.NULL, null);
	public static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
	public static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

	public static Value ofBool(boolean value)
	{
		return value ? TRUE : FALSE;
	}

	public static Value ofInt(long value)
	{
		return new Value(Type.INT, value);
	}

	public static Value ofFloat(double value)
	{
		return new Value(Type.FLOAT, value);
	}

	public static Value ofString(String value)
	{
		Objects.requireNonNull(value);
		return new Value(Type.STRING, value);
	}

	public static Value ofArray(List<Value> elements)
	{
		return new Value(Type.ARRAY, Collections.unmodifiableList(new ArrayList<>(elements)));
	}

	public static Value ofObject(Map<String, Value> fields)
	{
		return new Value(Type.OBJECT, Collections.unmodifiableMap(new TreeMap<>(fields)));
	}

	/**
	 * A helper for the common case of a 3-float vector (positions, scales, colours).
	 */
	public static Value vec3(double x, double y, double z)
	{
		return ofArray(List.of(ofFloat(x), ofFloat(y), ofFloat(z)));
	}


	private final Type _type;
	private final Object _data;

	private Value(Type type, Object data)
	{
		_type = type;
		_data = data;
	}

	public Type getType()
	{
		return _type;
	}

	public boolean asBool()
	{
		_requireType(Type.BOOL);
		return (Boolean)_data;
	}

	public long asInt()
	{
		_requireType(Type.INT);
		return (Long)_data;
	}

	/**
	 * @return The numeric value as a double (INT values are widened).
	 */
	public double asFloat()
	{
		if (Type.INT == _type)
		{
			return (double)(Long)_data;
		}
		_requireType(Type.FLOAT);
		return (Double)_data;
	}

	public String asString()
	{
		_requireType(Type.STRING);
		return (String)_data;
	}

	@SuppressWarnings("unchecked")
	public List<Value> asArray()
	{
		_requireType(Type.ARRAY);
		return (List<Value>)_data;
	}

	@SuppressWarnings("unchecked")
	public Map<String, Value> asObject()
	{
		_requireType(Type.OBJECT);
		return (Map<String, Value>)_data;
	}

	/**
	 * Returns an OBJECT with the given fields written over the fields of this OBJECT (fields in "overrides" win).
	 * 
	 * @param overrides The fields to write.
	 * @return The merged object.
	 */
	public Value withFields(Map<String, Value> overrides)
	{
		Map<String, Value> merged = new TreeMap<>(asObject());
		merged.putAll(overrides);
		return ofObject(merged);
	}

	/**
	 * @return A rough estimate of the heap bytes retained by this value, used for snapshot memory accounting.
	 */
	public long estimatedSize()
	{
		long size;
		switch (_type)
		{
		case NULL:
		case BOOL:
			size = 1L;
			break;
		case INT:
		case FLOAT:
			size = 8L;
			break;
		case STRING:
			size = 16L + 2L * ((String)_data).length();
			break;
		case ARRAY:
			size = 16L;
			for (Value element : asArray())
			{
				size += element.estimatedSize();
			}
			break;
		case OBJECT:
			size = 16L;
			for (Map.Entry<String, Value> elt : asObject().entrySet())
			{
				size += 2L * elt.getKey().length() + elt.getValue().estimatedSize();
			}
			break;
		default:
			throw Assert.unreachable();
		}
		return size;
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = false;
		if (this == obj)
		{
			isEqual = true;
		}
		else if (obj instanceof Value)
		{
			Value other = (Value)obj;
			isEqual = (_type == other._type) && Objects.equals(_data, other._data);
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return 31 * _type.hashCode() + Objects.hashCode(_data);
	}

	@Override
	public String toString()
	{
		String string;
		switch (_type)
		{
		case NULL:
			string = "null";
			break;
		case STRING:
			string = "\"" + _data + "\"";
			break;
		default:
			string = String.valueOf(_data);
		}
		return string;
	}


	private void _requireType(Type expected)
	{
		if (expected != _type)
		{
			throw new IllegalStateException("Value is " + _type + ", not " + expected);
		}
	}
}
