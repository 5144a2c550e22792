package com.mongodb.chunkplanner;

import java.io.File;
import java.util.concurrent.Callable;

import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.chunkplanner.cluster.ShardClient;
import com.mongodb.chunkplanner.commands.ApplyCommand;
import com.mongodb.chunkplanner.commands.BalancerCommand;
import com.mongodb.chunkplanner.commands.PlanCommand;
import com.mongodb.chunkplanner.commands.VerifyCommand;
import com.mongodb.chunkplanner.model.DistributionMetric;

import ch.qos.logback.classic.ClassicConstants;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;

@Command(name = "chunkPlanner",
		mixinStandardHelpOptions = true,
		version = "chunkPlanner 1.0",
		description = "Pre-split a sharded collection on its shard key and place the chunks evenly across shards",
		subcommands = {
				PlanCommand.class,
				ApplyCommand.class,
				VerifyCommand.class,
				BalancerCommand.class
		})
public class ChunkPlannerApp implements Callable<Integer> {

	public static final String CHUNK_PLANNER_PROPERTIES_FILE = "chunk-planner.properties";

	public static final int EXIT_OK = 0;
	public static final int EXIT_ERROR = 1;
	public static final int EXIT_INCOMPLETE = 2;

	private static Logger logger = LoggerFactory.getLogger(ChunkPlannerApp.class);

	@Option(names = {"-c", "--config"},
			description = "Configuration properties file, default: " + CHUNK_PLANNER_PROPERTIES_FILE,
			defaultValue = CHUNK_PLANNER_PROPERTIES_FILE)
	private File configFile;

	@Option(names = {"-s", "--source"}, description = "Cluster connection uri (mongos)")
	private String source;

	@Option(names = {"--namespace"}, description = "Target collection, db.collection")
	private String namespace;

	@Option(names = {"--primaryKeyField"}, description = "Shard key prefix field")
	private String primaryKeyField;

	@Option(names = {"--tiebreakerKeyField"}, description = "Second shard key field")
	private String tiebreakerKeyField;

	@Option(names = {"--domainMin"}, description = "Smallest primary key value (inclusive)")
	private Long domainMin;

	@Option(names = {"--domainMax"}, description = "Largest primary key value (exclusive)")
	private Long domainMax;

	@Option(names = {"--domainValues"}, split = ",", description = "Explicit string primary key values")
	private String[] domainValues;

	@Option(names = {"--shardCount"}, description = "Number of shards to place on, 0 for all")
	private Integer shardCount;

	@Option(names = {"--splitCount"}, description = "Number of ranges")
	private Integer splitCount;

	@Option(names = {"--tolerance"}, description = "Maximum acceptable skew between shard shares")
	private Double tolerance;

	@Option(names = {"--concurrency"}, description = "Parallel placement workers")
	private Integer concurrency;

	@Option(names = {"--assignmentPolicy"}, description = "roundRobin or weighted")
	private String assignmentPolicy;

	@Option(names = {"--shardWeights"}, split = ",", description = "shardId:weight pairs for the weighted policy")
	private String[] shardWeights;

	@Option(names = {"--distributionMetric"}, description = "count or bytes")
	private String distributionMetric;

	@Override
	public Integer call() throws Exception {
		CommandLine commandLine = new CommandLine(this);
		String subcommands = String.join(", ", commandLine.getSubcommands().keySet());
		System.out.println("Please specify a sub-command: " + subcommands);
		System.out.println("Use --help to see available options");
		return EXIT_ERROR;
	}

	/**
	 * Properties file values (when the file exists), overridden by any option given on
	 * the command line.
	 */
	public ChunkPlannerConfig buildConfig() throws ConfigurationException {
		ChunkPlannerConfig config;
		if (configFile != null && configFile.exists()) {
			config = ChunkPlannerConfig.load(configFile);
			logger.info("Loaded configuration from: {}", configFile.getAbsolutePath());
		} else {
			config = new ChunkPlannerConfig();
			logger.info("Configuration file not found: {}, using command-line arguments only",
					configFile == null ? CHUNK_PLANNER_PROPERTIES_FILE : configFile.getAbsolutePath());
		}
		if (source != null) {
			config.setSource(source);
		}
		if (namespace != null) {
			config.setNamespace(namespace);
		}
		if (primaryKeyField != null) {
			config.setPrimaryKeyField(primaryKeyField);
		}
		if (tiebreakerKeyField != null) {
			config.setTiebreakerKeyField(tiebreakerKeyField);
		}
		if (domainMin != null) {
			config.setDomainMin(domainMin);
		}
		if (domainMax != null) {
			config.setDomainMax(domainMax);
		}
		if (domainValues != null) {
			config.setDomainValues(domainValues);
		}
		if (shardCount != null) {
			config.setShardCount(shardCount);
		}
		if (splitCount != null) {
			config.setSplitCount(splitCount);
		}
		if (tolerance != null) {
			config.setTolerance(tolerance);
		}
		if (concurrency != null) {
			config.setConcurrency(concurrency);
		}
		if (assignmentPolicy != null) {
			config.setAssignmentPolicy(assignmentPolicy);
		}
		if (shardWeights != null) {
			config.setShardWeights(ChunkPlannerConfig.parseShardWeights(shardWeights));
		}
		if (distributionMetric != null) {
			config.setDistributionMetric(DistributionMetric.fromString(distributionMetric));
		}
		config.validate();
		return config;
	}

	public ShardClient connect(ChunkPlannerConfig config) {
		if (config.getSource() == null) {
			throw new IllegalArgumentException(ChunkPlannerConfig.SOURCE + " is required, use --source or "
					+ CHUNK_PLANNER_PROPERTIES_FILE);
		}
		ShardClient client = new ShardClient("source", config.getSource(), config.getOperationTimeoutMs());
		try {
			client.init();
		} catch (RuntimeException e) {
			client.close();
			throw e;
		}
		return client;
	}

	/**
	 * Invalid configuration is reported as a one line usage error, anything else is
	 * logged with its stack trace. Both exit with {@link #EXIT_ERROR}.
	 */
	public static CommandLine commandLine() {
		CommandLine cmd = new CommandLine(new ChunkPlannerApp());
		cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
			if (ex instanceof IllegalArgumentException) {
				System.err.println(ex.getMessage());
			} else {
				logger.error("Fatal error", ex);
			}
			return EXIT_ERROR;
		});
		return cmd;
	}

	public static void main(String[] args) {
		System.setProperty(ClassicConstants.CONFIG_FILE_PROPERTY, "chunkplanner_logback.xml");

		CommandLine cmd = commandLine();
		try {
			ParseResult parseResult = cmd.parseArgs(args);
			if (CommandLine.printHelpIfRequested(parseResult)) {
				System.exit(EXIT_OK);
			}
		} catch (ParameterException ex) {
			System.err.println(ex.getMessage());
			ex.getCommandLine().usage(System.err);
			System.exit(EXIT_ERROR);
		}
		int exitCode = cmd.execute(args);
		System.exit(exitCode);
	}
}
