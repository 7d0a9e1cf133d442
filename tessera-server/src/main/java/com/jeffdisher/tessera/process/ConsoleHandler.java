package com.jeffdisher.tessera.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.jeffdisher.tessera.config.KernelConfig;
import com.jeffdisher.tessera.kernel.Kernel;
import com.jeffdisher.tessera.namespaces.NamespaceInfo;
import com.jeffdisher.tessera.server.FrameReport;
import com.jeffdisher.tessera.server.MonitoringAgent;
import com.jeffdisher.tessera.snapshots.StateSnapshot;
import com.jeffdisher.tessera.types.NamespaceId;
import com.jeffdisher.tessera.types.SnapshotId;


/**
 * Handles the kernel's stdin, processing commands from it.
 */
public class ConsoleHandler
{
	/**
	 * Processes commands (on the calling thread) until a shutdown command is received or the input ends.
	 *
	 * @param in The input stream.
	 * @param out The output stream.
	 * @param monitoringAgent The shared agent structure which collects information from the rest of the system.
	 * @param mutableSharedConfig The shared config object used by the system (changes will immediately take effect).
	 * @throws IOException If there was an error reading the input.
	 */
	public static void readUntilStop(InputStream in
			, PrintStream out
			, MonitoringAgent monitoringAgent
			, KernelConfig mutableSharedConfig
	) throws IOException
	{
		// We will read lines until we get a stop command.
		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		_ConsoleState state = new _ConsoleState(monitoringAgent, mutableSharedConfig);
		while (state.canContinue)
		{
			_readAndProcessOneLine(out, reader, state);
		}
		out.println("Shutting down...");
	}


	private static void _readAndProcessOneLine(PrintStream out, BufferedReader reader, _ConsoleState state) throws IOException
	{
		String line = reader.readLine();
		if (null == line)
		{
			// The input was closed so treat this like a stop.
			state.canContinue = false;
			return;
		}
		String[] fragments = line.split(" ");
		String first = fragments[0];
		if (first.startsWith("!"))
		{
			String name = first.substring(1);

			// Drop any empty string fragments.
			List<String> nonEmpty = new ArrayList<>();
			for (int i = 1; i < fragments.length; ++i)
			{
				String fragment = fragments[i];
				if (fragment.length() > 0)
				{
					nonEmpty.add(fragment);
				}
			}
			String[] params = nonEmpty.toArray((int size) -> new String[size]);

			_Command command;
			try
			{
				command = _Command.valueOf(name.toUpperCase());
			}
			catch (IllegalArgumentException e)
			{
				command = null;
			}
			if (null != command)
			{
				command.handler.run(out, state, params);
			}
			else
			{
				out.println("Command \"" + name + "\" unknown");
				_usage(out);
			}
		}
		else
		{
			_usage(out);
		}
	}

	private static void _usage(PrintStream out)
	{
		out.println("Run !help for commands");
	}


	private static class _ConsoleState
	{
		public boolean canContinue = true;
		public final MonitoringAgent monitoringAgent;
		public final KernelConfig mutableSharedConfig;
		public _ConsoleState(MonitoringAgent monitoringAgent, KernelConfig mutableSharedConfig)
		{
			this.monitoringAgent = monitoringAgent;
			this.mutableSharedConfig = mutableSharedConfig;
		}
	}

	private static interface _CommandHandler
	{
		void run(PrintStream out, _ConsoleState state, String[] parameters);
	}

	private static enum _Command
	{
		HELP((PrintStream out, _ConsoleState state, String[] parameters) -> {
			out.println("Commands:");
			for (_Command command : _Command.values())
			{
				out.println("!" + command.name());
			}
		}),
		STOP((PrintStream out, _ConsoleState state, String[] parameters) -> {
			state.canContinue = false;
		}),
		STATS((PrintStream out, _ConsoleState state, String[] parameters) -> {
			FrameReport report = state.monitoringAgent.getLastReport();
			if (null != report)
			{
				report.writeToStream(out);
			}
			else
			{
				out.println("No frames run yet");
			}
		}),
		NAMESPACES((PrintStream out, _ConsoleState state, String[] parameters) -> {
			Kernel kernel = state.monitoringAgent.getKernel();
			List<NamespaceId> ids = kernel.getNamespaces().getNamespaceIds();
			out.println("Namespaces (" + ids.size() + "):");
			for (NamespaceId id : ids)
			{
				NamespaceInfo info = kernel.getNamespaces().getInfo(id);
				// The namespace could have been destroyed since we read the list.
				if (null != info)
				{
					out.println("\t" + id.value() + " - " + info.name()
							+ " (entities: " + info.entities().size()
							+ ", layers: " + info.layers().size()
							+ ", assets: " + info.assets().size()
							+ ", capabilities: " + kernel.getCapabilities().getCapabilities(id).size()
							+ ")"
					);
				}
			}
		}),
		DESTROY_NAMESPACE((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <namespace_id>.
			long id = (1 == parameters.length) ? _readLong(parameters[0], -1L) : -1L;
			if (id > 0L)
			{
				state.monitoringAgent.getCommandSink().requestDestroyNamespace(new NamespaceId(id));
			}
			else
			{
				out.println("Usage:  <namespace_id>");
			}
		}),
		SNAPSHOT((PrintStream out, _ConsoleState state, String[] parameters) -> {
			state.monitoringAgent.getCommandSink().requestSnapshot();
			out.println("Snapshot requested");
		}),
		SNAPSHOTS((PrintStream out, _ConsoleState state, String[] parameters) -> {
			List<StateSnapshot> snapshots = state.monitoringAgent.getKernel().getSnapshots().list();
			out.println("Snapshots (" + snapshots.size() + "):");
			for (StateSnapshot snapshot : snapshots)
			{
				out.println("\t" + snapshot.getId().value() + " - frame " + snapshot.getFrame() + ", " + snapshot.memorySize() + " bytes");
			}
		}),
		ROLLBACK((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <snapshot_id>.
			long id = (1 == parameters.length) ? _readLong(parameters[0], -1L) : -1L;
			if (id > 0L)
			{
				state.monitoringAgent.getCommandSink().requestRollback(new SnapshotId(id));
				out.println("Rollback to snapshot " + id + " requested");
			}
			else
			{
				out.println("Usage:  <snapshot_id>");
			}
		}),
		PAUSE((PrintStream out, _ConsoleState state, String[] parameters) -> {
			state.monitoringAgent.getCommandSink().pauseFrameProcessing();
			out.println("Frame processing paused");
		}),
		RESUME((PrintStream out, _ConsoleState state, String[] parameters) -> {
			state.monitoringAgent.getCommandSink().resumeFrameProcessing();
			out.println("Frame processing resumed");
		}),
		CONFIG((PrintStream out, _ConsoleState state, String[] parameters) -> {
			for (Map.Entry<String, String> elt : state.mutableSharedConfig.getRawOptions().entrySet())
			{
				out.println("\t" + elt.getKey() + " = " + elt.getValue());
			}
		}),
		SET_DEFER((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <on/off>.
			String mode = (1 == parameters.length) ? parameters[0].toUpperCase() : "";
			if ("ON".equals(mode))
			{
				state.mutableSharedConfig.deferConflictingTransactions = true;
			}
			else if ("OFF".equals(mode))
			{
				state.mutableSharedConfig.deferConflictingTransactions = false;
			}
			else
			{
				out.println("Usage:  <on/off>");
			}
		}),
		;

		public final _CommandHandler handler;

		private _Command(_CommandHandler handler)
		{
			this.handler = handler;
		}

		private static long _readLong(String value, long defaultValue)
		{
			long read = defaultValue;
			try
			{
				read = Long.parseLong(value);
			}
			catch (NumberFormatException e)
			{
				// Not a valid long so use the default.
				read = defaultValue;
			}
			return read;
		}
	}
}
