package com.jeffdisher.tessera.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;


/**
 * The tunable options of the kernel.  A single instance is shared by the components of a running kernel and fields
 * are volatile so that the console can change some of them while frames are running (changes to the queue and
 * snapshot limits only take effect for components created after the change).
 */
public class KernelConfig
{
	/**
	 * 16 ms/frame is roughly 60 frames/sec.
	 */
	public static final long DEFAULT_MILLIS_PER_FRAME = 16L;

	public static final String KEY_MILLIS_PER_FRAME = "millis_per_frame";
	public volatile long millisPerFrame;
	public static final String KEY_MAX_DELTA_TIME = "max_delta_time";
	public volatile float maxDeltaTime;
	public static final String KEY_MAX_PENDING_TRANSACTIONS = "max_pending_transactions";
	public volatile int maxPendingTransactions;
	public static final String KEY_MAX_PATCHES_PER_TRANSACTION = "max_patches_per_transaction";
	public volatile int maxPatchesPerTransaction;
	public static final String KEY_CHANNEL_CAPACITY = "channel_capacity";
	public volatile int channelCapacity;
	public static final String KEY_MAX_PENDING_FRAMES = "max_pending_frames";
	public volatile long maxPendingFrames;
	public static final String KEY_COMMIT_LOG_KEEP = "commit_log_keep";
	public volatile int commitLogKeep;
	public static final String KEY_MAX_SNAPSHOTS = "max_snapshots";
	public volatile int maxSnapshots;
	public static final String KEY_MAX_SNAPSHOT_MEMORY = "max_snapshot_memory";
	public volatile long maxSnapshotMemory;
	public static final String KEY_OPTIMIZE_TRANSACTIONS = "optimize_transactions";
	public volatile boolean optimizeTransactions;
	public static final String KEY_DEFER_CONFLICTING_TRANSACTIONS = "defer_conflicting_transactions";
	public volatile boolean deferConflictingTransactions;

	/**
	 * Creates a config with all default options.
	 */
	public KernelConfig()
	{
		this.millisPerFrame = DEFAULT_MILLIS_PER_FRAME;
		this.maxDeltaTime = 0.25f;
		this.maxPendingTransactions = 1000;
		this.maxPatchesPerTransaction = 10_000;
		this.channelCapacity = 256;
		// 10 seconds at the default frame rate.
		this.maxPendingFrames = 600L;
		this.commitLogKeep = 1000;
		this.maxSnapshots = 10;
		this.maxSnapshotMemory = 100L * 1024L * 1024L;
		this.optimizeTransactions = true;
		this.deferConflictingTransactions = false;
	}

	/**
	 * Applies the given raw options over the current values.  Unknown keys are ignored.
	 * 
	 * @param overrides The raw key-value options (as read from a tab list file).
	 * @throws TabListReader.TabListException One of the values was invalid (nothing is changed in this case).
	 */
	public void loadOverrides(Map<String, String> overrides) throws TabListReader.TabListException
	{
		// Parse everything before changing anything so that a bad file can't leave us half-configured.
		long millisPerFrame = _long(overrides, KEY_MILLIS_PER_FRAME, 1L, 60_000L, this.millisPerFrame);
		float maxDeltaTime = overrides.containsKey(KEY_MAX_DELTA_TIME)
				? new IValueTransformer.PositiveFloatTransformer(KEY_MAX_DELTA_TIME).transform(overrides.get(KEY_MAX_DELTA_TIME))
				: this.maxDeltaTime
		;
		int maxPendingTransactions = (int)_long(overrides, KEY_MAX_PENDING_TRANSACTIONS, 1L, Integer.MAX_VALUE, this.maxPendingTransactions);
		int maxPatchesPerTransaction = (int)_long(overrides, KEY_MAX_PATCHES_PER_TRANSACTION, 1L, Integer.MAX_VALUE, this.maxPatchesPerTransaction);
		int channelCapacity = (int)_long(overrides, KEY_CHANNEL_CAPACITY, 1L, Integer.MAX_VALUE, this.channelCapacity);
		long maxPendingFrames = _long(overrides, KEY_MAX_PENDING_FRAMES, 1L, Long.MAX_VALUE, this.maxPendingFrames);
		int commitLogKeep = (int)_long(overrides, KEY_COMMIT_LOG_KEEP, 0L, Integer.MAX_VALUE, this.commitLogKeep);
		int maxSnapshots = (int)_long(overrides, KEY_MAX_SNAPSHOTS, 1L, Integer.MAX_VALUE, this.maxSnapshots);
		long maxSnapshotMemory = _long(overrides, KEY_MAX_SNAPSHOT_MEMORY, 1L, Long.MAX_VALUE, this.maxSnapshotMemory);
		boolean optimizeTransactions = _boolean(overrides, KEY_OPTIMIZE_TRANSACTIONS, this.optimizeTransactions);
		boolean deferConflictingTransactions = _boolean(overrides, KEY_DEFER_CONFLICTING_TRANSACTIONS, this.deferConflictingTransactions);
		
		this.millisPerFrame = millisPerFrame;
		this.maxDeltaTime = maxDeltaTime;
		this.maxPendingTransactions = maxPendingTransactions;
		this.maxPatchesPerTransaction = maxPatchesPerTransaction;
		this.channelCapacity = channelCapacity;
		this.maxPendingFrames = maxPendingFrames;
		this.commitLogKeep = commitLogKeep;
		this.maxSnapshots = maxSnapshots;
		this.maxSnapshotMemory = maxSnapshotMemory;
		this.optimizeTransactions = optimizeTransactions;
		this.deferConflictingTransactions = deferConflictingTransactions;
	}

	public Map<String, String> getRawOptions()
	{
		// We use a sorted map so that stored files are stable.
		Map<String, String> options = new TreeMap<>();
		options.put(KEY_MILLIS_PER_FRAME, Long.toString(this.millisPerFrame));
		options.put(KEY_MAX_DELTA_TIME, Float.toString(this.maxDeltaTime));
		options.put(KEY_MAX_PENDING_TRANSACTIONS, Integer.toString(this.maxPendingTransactions));
		options.put(KEY_MAX_PATCHES_PER_TRANSACTION, Integer.toString(this.maxPatchesPerTransaction));
		options.put(KEY_CHANNEL_CAPACITY, Integer.toString(this.channelCapacity));
		options.put(KEY_MAX_PENDING_FRAMES, Long.toString(this.maxPendingFrames));
		options.put(KEY_COMMIT_LOG_KEEP, Integer.toString(this.commitLogKeep));
		options.put(KEY_MAX_SNAPSHOTS, Integer.toString(this.maxSnapshots));
		options.put(KEY_MAX_SNAPSHOT_MEMORY, Long.toString(this.maxSnapshotMemory));
		options.put(KEY_OPTIMIZE_TRANSACTIONS, Boolean.toString(this.optimizeTransactions));
		options.put(KEY_DEFER_CONFLICTING_TRANSACTIONS, Boolean.toString(this.deferConflictingTransactions));
		return options;
	}

	/**
	 * Reads a tab list config file from stream and applies it as overrides to this config.
	 * 
	 * @param stream The stream to read (closed on return).
	 * @throws IOException There was a problem reading the stream.
	 * @throws TabListReader.TabListException The file was malformed or contained an invalid value.
	 */
	public void loadFromStream(InputStream stream) throws IOException, TabListReader.TabListException
	{
		FlatTabListCallbacks<String, String> callbacks = new FlatTabListCallbacks<>(new IValueTransformer.StringTransformer(), new IValueTransformer.StringTransformer());
		TabListReader.readEntireFile(callbacks, stream);
		loadOverrides(callbacks.data);
	}

	/**
	 * Writes the current options to stream in tab list form (the stream is not closed).
	 * 
	 * @param stream The destination.
	 * @throws IOException There was a problem writing the stream.
	 */
	public void storeToStream(OutputStream stream) throws IOException
	{
		stream.write("# Tessera kernel config.  This uses the tablist format and errors will cause start-up failures.\n\n".getBytes(StandardCharsets.UTF_8));
		for (Map.Entry<String, String> elt : getRawOptions().entrySet())
		{
			String line = elt.getKey() + "\t" + elt.getValue() + "\n";
			stream.write(line.getBytes(StandardCharsets.UTF_8));
		}
	}


	private static long _long(Map<String, String> overrides, String key, long min, long max, long current) throws TabListReader.TabListException
	{
		return overrides.containsKey(key)
				? new IValueTransformer.BoundedLongTransformer(key, min, max).transform(overrides.get(key))
				: current
		;
	}

	private static boolean _boolean(Map<String, String> overrides, String key, boolean current) throws TabListReader.TabListException
	{
		return overrides.containsKey(key)
				? new IValueTransformer.BooleanTransformer(key).transform(overrides.get(key))
				: current
		;
	}
}
