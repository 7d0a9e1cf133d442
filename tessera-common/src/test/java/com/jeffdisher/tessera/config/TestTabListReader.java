package com.jeffdisher.tessera.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.tessera.config.TabListReader.TabListException;


public class TestTabListReader
{
	@Test
	public void empty() throws Throwable
	{
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks();
		_readFile(callbacks, "\n");
	}

	@Test(expected=TabListException.class)
	public void malformed() throws Throwable
	{
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks();
		_readFile(callbacks, " this should fail \n");
	}

	@Test
	public void nameList() throws Throwable
	{
		List<String> names = new ArrayList<>();
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks() {
			@Override
			public void startNewRecord(String name)
			{
				names.add(name);
			}
			@Override
			public void endRecord()
			{
			}
		};
		_readFile(callbacks, "one\ntwo\n\n# comment\nthree\n");
		Assert.assertEquals(List.of("one", "two", "three"), names);
	}

	@Test
	public void nameListWindows() throws Throwable
	{
		List<String> names = new ArrayList<>();
		TabListReader.IParseCallbacks callbacks = new _FailingCallbacks() {
			@Override
			public void startNewRecord(String name)
			{
				names.add(name);
			}
			@Override
			public void endRecord()
			{
			}
		};
		_readFile(callbacks, "one\r\ntwo\r\n\r\nthree");
		Assert.assertEquals(List.of("one", "two", "three"), names);
	}

	@Test
	public void subRecords() throws Throwable
	{
		List<String> events = new ArrayList<>();
		TabListReader.IParseCallbacks callbacks = new TabListReader.IParseCallbacks() {
			@Override
			public void startNewRecord(String name)
			{
				events.add("start " + name);
			}
			@Override
			public void handleParameter(String value)
			{
				events.add("param " + value);
			}
			@Override
			public void endRecord()
			{
				events.add("end");
			}
			@Override
			public void startSubRecord(String name)
			{
				events.add("sub " + name);
			}
			@Override
			public void endSubRecord()
			{
				events.add("endsub");
			}
		};
		_readFile(callbacks, "layer\tcontent\n\tpriority\t5\nnext\n");
		Assert.assertEquals(List.of("start layer", "param content", "sub priority", "param 5", "endsub", "end", "start next", "end"), events);
	}

	@Test(expected=TabListException.class)
	public void orphanSubRecord() throws Throwable
	{
		_readFile(new _FailingCallbacks(), "\tpriority\t5\n");
	}

	@Test
	public void flatCallbacks() throws Throwable
	{
		FlatTabListCallbacks<String, String> callbacks = new FlatTabListCallbacks<>(new IValueTransformer.StringTransformer(), new IValueTransformer.StringTransformer());
		_readFile(callbacks, "b\t2\na\t1\n");
		Assert.assertEquals(List.of("b", "a"), callbacks.keyOrder);
		Assert.assertEquals("1", callbacks.data.get("a"));
		Assert.assertEquals("2", callbacks.data.get("b"));
	}

	@Test(expected=TabListException.class)
	public void flatDuplicateKey() throws Throwable
	{
		FlatTabListCallbacks<String, String> callbacks = new FlatTabListCallbacks<>(new IValueTransformer.StringTransformer(), new IValueTransformer.StringTransformer());
		_readFile(callbacks, "a\t1\na\t2\n");
	}

	@Test(expected=TabListException.class)
	public void flatMissingValue() throws Throwable
	{
		FlatTabListCallbacks<String, String> callbacks = new FlatTabListCallbacks<>(new IValueTransformer.StringTransformer(), new IValueTransformer.StringTransformer());
		_readFile(callbacks, "a\n");
	}

	@Test(expected=TabListException.class)
	public void flatTooManyValues() throws Throwable
	{
		FlatTabListCallbacks<String, String> callbacks = new FlatTabListCallbacks<>(new IValueTransformer.StringTransformer(), new IValueTransformer.StringTransformer());
		_readFile(callbacks, "a\t1\t2\n");
	}


	private static void _readFile(TabListReader.IParseCallbacks callbacks, String contents) throws IOException, TabListException
	{
		TabListReader.readEntireFile(callbacks, new ByteArrayInputStream(contents.getBytes(StandardCharsets.UTF_8)));
	}


	private static class _FailingCallbacks implements TabListReader.IParseCallbacks
	{
		@Override
		public void startNewRecord(String name) throws TabListException
		{
			throw new AssertionError("startNewRecord");
		}
		@Override
		public void handleParameter(String value) throws TabListException
		{
			throw new AssertionError("handleParameter");
		}
		@Override
		public void endRecord() throws TabListException
		{
			throw new AssertionError("endRecord");
		}
		@Override
		public void startSubRecord(String name) throws TabListException
		{
			throw new AssertionError("startSubRecord");
		}
		@Override
		public void endSubRecord() throws TabListException
		{
			throw new AssertionError("endSubRecord");
		}
	}
}
