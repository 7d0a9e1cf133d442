package com.jeffdisher.tessera.process;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

import com.jeffdisher.tessera.config.KernelConfig;
import com.jeffdisher.tessera.config.TabListReader;
import com.jeffdisher.tessera.kernel.Kernel;
import com.jeffdisher.tessera.server.FrameReport;
import com.jeffdisher.tessera.server.KernelRunner;
import com.jeffdisher.tessera.server.MonitoringAgent;
import com.jeffdisher.tessera.utils.Assert;
import com.jeffdisher.tessera.world.ArenaWorld;


public class KernelMain
{
	public static final String CONFIG_FILE_NAME = "kernel.tablist";

	public static void main(String[] args)
	{
		// We only accept 1 optional argument:  the config file.
		if (args.length <= 1)
		{
			File configFile = new File((1 == args.length) ? args[0] : CONFIG_FILE_NAME);
			System.out.println("Starting kernel...");
			try
			{
				KernelConfig config = new KernelConfig();
				boolean didLoadFile = populateConfig(configFile, config);
				System.out.println(didLoadFile
						? ("Loaded config from " + configFile)
						: "Using bundled default config"
				);
				MonitoringAgent monitoringAgent = new MonitoringAgent();
				Kernel kernel = new Kernel(config, () -> System.currentTimeMillis());
				KernelRunner runner = new KernelRunner(config.millisPerFrame
						, kernel
						, new ArenaWorld()
						, () -> System.currentTimeMillis()
						, monitoringAgent
						, null
				);
				// Hand over control to the ConsoleHandler.  Once it returns, we can shut down.
				ConsoleHandler.readUntilStop(System.in, System.out, monitoringAgent, config);
				runner.shutdown();
				FrameReport lastReport = monitoringAgent.getLastReport();
				long framesRun = (null != lastReport)
						? lastReport.frame()
						: 0L
				;
				System.out.println("Ran " + framesRun + " frames");
				System.out.println("Exiting normally");
			}
			catch (IOException e)
			{
				e.printStackTrace();
				System.exit(2);
			}
		}
		else
		{
			System.err.println("Usage:  KernelMain [config_file]");
			System.exit(1);
		}
	}

	/**
	 * Loads config overrides from the given file, if it exists, or from the default bundled in the jar, otherwise.
	 *
	 * @param configFile The file to read.
	 * @param config The config to update.
	 * @return True if the file was read, false if the bundled default was used.
	 * @throws IOException There was a problem reading the file.
	 */
	public static boolean populateConfig(File configFile, KernelConfig config) throws IOException
	{
		boolean didLoadFile = configFile.exists();
		try (InputStream stream = didLoadFile
				? new FileInputStream(configFile)
				: KernelMain.class.getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)
		)
		{
			// The bundled default is part of the build so it must be present.
			Assert.assertNotNull(stream);
			config.loadFromStream(stream);
		}
		catch (TabListReader.TabListException e)
		{
			// We will treat this as a static start-up failure.
			throw Assert.unexpected(e);
		}
		return didLoadFile;
	}
}
