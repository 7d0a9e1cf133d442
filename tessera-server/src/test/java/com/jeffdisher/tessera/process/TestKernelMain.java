package com.jeffdisher.tessera.process;

import java.io.File;
import java.io.FileOutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.Assert;
import org.junit.ClassRule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.jeffdisher.tessera.config.KernelConfig;


public class TestKernelMain
{
	@ClassRule
	public static TemporaryFolder DIRECTORY = new TemporaryFolder();

	@Test
	public void bundledDefault() throws Throwable
	{
		File missing = new File(DIRECTORY.newFolder(), KernelMain.CONFIG_FILE_NAME);
		KernelConfig config = new KernelConfig();
		Assert.assertFalse(KernelMain.populateConfig(missing, config));
		// The bundled file matches the built-in defaults.
		Assert.assertEquals(new KernelConfig().getRawOptions(), config.getRawOptions());
	}

	@Test
	public void overridesFromFile() throws Throwable
	{
		File file = new File(DIRECTORY.newFolder(), KernelMain.CONFIG_FILE_NAME);
		try (FileOutputStream stream = new FileOutputStream(file))
		{
			stream.write(("# partial override\n"
					+ "millis_per_frame\t33\n"
					+ "defer_conflicting_transactions\ttrue\n"
			).getBytes(StandardCharsets.UTF_8));
		}
		KernelConfig config = new KernelConfig();
		Assert.assertTrue(KernelMain.populateConfig(file, config));
		Assert.assertEquals(33L, config.millisPerFrame);
		Assert.assertTrue(config.deferConflictingTransactions);
		// Everything else keeps its default.
		Assert.assertEquals(256, config.channelCapacity);
		Assert.assertEquals(10, config.maxSnapshots);
	}
}
