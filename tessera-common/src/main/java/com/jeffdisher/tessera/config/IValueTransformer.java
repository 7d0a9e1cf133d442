package com.jeffdisher.tessera.config;


/**
 * Converts a raw string from a tab list file into a typed value.
 * 
 * @param <T> The output type.
 */
public interface IValueTransformer<T>
{
	T transform(String value) throws TabListReader.TabListException;

	/**
	 * Passes the string through unchanged.
	 */
	public static class StringTransformer implements IValueTransformer<String>
	{
		@Override
		public String transform(String value)
		{
			return value;
		}
	}

	/**
	 * Decodes a long which must be within [min, max].
	 */
	public static class BoundedLongTransformer implements IValueTransformer<Long>
	{
		private final String _name;
		private final long _min;
		private final long _max;
		public BoundedLongTransformer(String name, long min, long max)
		{
			_name = name;
			_min = min;
			_max = max;
		}
		@Override
		public Long transform(String value) throws TabListReader.TabListException
		{
			long parsed;
			try
			{
				parsed = Long.parseLong(value.strip());
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
			if ((parsed < _min) || (parsed > _max))
			{
				throw new TabListReader.TabListException("Value for " + _name + " must be in [" + _min + ", " + _max + "]");
			}
			return parsed;
		}
	}

	/**
	 * Decodes a positive float.
	 */
	public static class PositiveFloatTransformer implements IValueTransformer<Float>
	{
		private final String _name;
		public PositiveFloatTransformer(String name)
		{
			_name = name;
		}
		@Override
		public Float transform(String value) throws TabListReader.TabListException
		{
			float parsed;
			try
			{
				parsed = Float.parseFloat(value.strip());
			}
			catch (NumberFormatException e)
			{
				throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
			}
			if (!(parsed > 0.0f) || Float.isInfinite(parsed))
			{
				throw new TabListReader.TabListException("Value for " + _name + " must be positive and finite");
			}
			return parsed;
		}
	}

	/**
	 * Decodes "true" or "false" (case-insensitive); anything else is an error.
	 */
	public static class BooleanTransformer implements IValueTransformer<Boolean>
	{
		private final String _name;
		public BooleanTransformer(String name)
		{
			_name = name;
		}
		@Override
		public Boolean transform(String value) throws TabListReader.TabListException
		{
			String clean = value.strip();
			if ("true".equalsIgnoreCase(clean))
			{
				return true;
			}
			else if ("false".equalsIgnoreCase(clean))
			{
				return false;
			}
			throw new TabListReader.TabListException("Not a valid " + _name + ": \"" + value + "\"");
		}
	}
}
