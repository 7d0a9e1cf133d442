package com.jeffdisher.tessera.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import com.jeffdisher.tessera.utils.Assert;


/**
 * Reads the "tab list" format used for the kernel's configuration files.
 * Each non-empty line which doesn't start with '#' is a record:  the fields are separated by tabs, the first field
 * being the record name and the rest its parameters.  A line which starts with a tab is a sub-record of the record
 * above it.  Since tabs never appear inside a value, no quoting is needed.
 */
public class TabListReader
{
	/**
	 * Parses an entire stream, sending the parse events to callbacks, and closes the stream when done.
	 * 
	 * @param callbacks Receives the parser events as the parse runs.
	 * @param stream The UTF-8 data to parse (closed on return).
	 * @throws IOException There was a problem reading the stream.
	 * @throws TabListException The data wasn't well-formed.
	 */
	public static void readEntireFile(IParseCallbacks callbacks, InputStream stream) throws IOException, TabListException
	{
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)))
		{
			TabListReader parser = new TabListReader(callbacks);
			String line = reader.readLine();
			while (null != line)
			{
				parser.handleLine(line);
				line = reader.readLine();
			}
			parser.finish();
		}
	}


	private final IParseCallbacks _callbacks;
	private boolean _isInRecord;

	private TabListReader(IParseCallbacks callbacks)
	{
		_callbacks = callbacks;
	}

	public void handleLine(String line) throws TabListException
	{
		if (line.isEmpty() || ('#' == line.charAt(0)))
		{
			return;
		}
		String[] parts = line.split("\t");
		Assert.assertTrue(parts.length > 0);
		
		boolean isSubRecord = parts[0].isEmpty();
		int nameIndex = isSubRecord ? 1 : 0;
		if (nameIndex >= parts.length)
		{
			throw new TabListException("Record name missing");
		}
		String name = parts[nameIndex];
		if (name.isEmpty() || (name.strip().length() < name.length()))
		{
			throw new TabListException("Record names cannot be empty or start/end with whitespace");
		}
		
		if (isSubRecord)
		{
			if (!_isInRecord)
			{
				throw new TabListException("Sub-record \"" + name + "\" has no outer record");
			}
			_callbacks.startSubRecord(name);
			_sendParameters(parts, nameIndex + 1);
			_callbacks.endSubRecord();
		}
		else
		{
			if (_isInRecord)
			{
				_callbacks.endRecord();
			}
			_callbacks.startNewRecord(name);
			_sendParameters(parts, nameIndex + 1);
			_isInRecord = true;
		}
	}

	public void finish() throws TabListException
	{
		if (_isInRecord)
		{
			_callbacks.endRecord();
			_isInRecord = false;
		}
	}


	private void _sendParameters(String[] parts, int start) throws TabListException
	{
		for (int i = start; i < parts.length; ++i)
		{
			_callbacks.handleParameter(parts[i]);
		}
	}


	/**
	 * Receives the events of a parse.
	 */
	public interface IParseCallbacks
	{
		/**
		 * Called when a new top-level record starts.
		 * 
		 * @param name The name of the record.
		 * @throws TabListException The record is unexpected or invalid.
		 */
		void startNewRecord(String name) throws TabListException;
		/**
		 * Called for each parameter of the current record or sub-record.
		 * 
		 * @param value The parameter.
		 * @throws TabListException The parameter is unexpected or invalid.
		 */
		void handleParameter(String value) throws TabListException;
		/**
		 * Called when the current record ends.
		 * 
		 * @throws TabListException The record was incomplete.
		 */
		void endRecord() throws TabListException;
		/**
		 * Called when a sub-record starts within the current record.
		 * 
		 * @param name The name of the sub-record.
		 * @throws TabListException The sub-record is unexpected or invalid.
		 */
		void startSubRecord(String name) throws TabListException;
		/**
		 * Called when the current sub-record ends.
		 * 
		 * @throws TabListException The sub-record was incomplete.
		 */
		void endSubRecord() throws TabListException;
	}

	/**
	 * Reports logical errors in the data being parsed.
	 */
	public static class TabListException extends Exception
	{
		private static final long serialVersionUID = 1L;
		public TabListException(String message)
		{
			super(message);
		}
	}
}
