package dqnblob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.Properties;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String PROPERTIES_RESOURCE = "/dqnblob.properties";
    static final int COMPETE_EPISODES = 300;
    static final int EVALUATION_EPISODES = 5;

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    // Usage: [harvest|compete] [outputDir]  or  demo [harvest|compete] [modelDir]
    static int run(String[] args) {
        String mode = args.length > 0 ? args[0] : "harvest";

        log.info("==============================================");
        log.info(" Starting Blob DQN (Java / DL4J) ");
        log.info("==============================================");
        SimpleDateFormat formatter = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss");
        log.info("Timestamp: {}", formatter.format(new Date()));

        try {
            Properties props = loadProperties();
            switch (mode) {
                case "harvest":
                    runHarvest(props, new File(args.length > 1 ? args[1] : "models"));
                    break;
                case "compete":
                    runCompete(props, new File(args.length > 1 ? args[1] : "models"));
                    break;
                case "demo":
                    String world = args.length > 1 ? args[1] : "harvest";
                    File modelDir = new File(args.length > 2 ? args[2] : "models");
                    if (world.equals("harvest")) {
                        runHarvestDemo(props, modelDir);
                    } else if (world.equals("compete")) {
                        runCompeteDemo(props, modelDir);
                    } else {
                        log.error("Unknown demo world '{}'. Usage: Main demo [harvest|compete] [modelDir]", world);
                        return EXIT_USAGE;
                    }
                    break;
                default:
                    log.error("Unknown mode '{}'. Usage: Main [harvest|compete|demo] ...", mode);
                    return EXIT_USAGE;
            }
        } catch (FileNotFoundException e) {
            log.error("Model not found: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (SnapshotException e) {
            log.error("Model does not fit this network: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Run failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }

        log.info("==============================================");
        log.info(" Blob DQN (Java/DL4J) Finished ");
        log.info("==============================================");
        return EXIT_OK;
    }

    // Classpath defaults, overridden by -D system properties
    static Properties loadProperties() throws IOException {
        Properties props = new Properties();
        try (InputStream in = Main.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("dqn.") || key.startsWith("env.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return props;
    }

    private static Config competeConfig(Properties props) {
        Config.Builder builder = Config.builder().apply(props);
        if (!props.containsKey("dqn.numEpisodes")) {
            builder.numEpisodes(COMPETE_EPISODES);
        }
        return builder.build();
    }

    private static void runHarvest(Properties props, File outputDir) throws IOException {
        Config config = Config.fromProperties(props);
        EnvConfig envConfig = EnvConfig.harvest().toBuilder().apply(props).build();
        log.info("{}", config);
        log.info("{}", envConfig);

        HarvestTrainer trainer = new HarvestTrainer(config, envConfig);
        trainer.train();
        logHarvestEvaluation(trainer.evaluate(EVALUATION_EPISODES));

        export(trainer.getAgent(), outputDir, "blob");
        ParameterJson.writeEnvConfig(envConfig, HarvestEnv.STATE_SIZE, Action.COUNT, new File(outputDir, "env_config.json"));
    }

    private static void runCompete(Properties props, File outputDir) throws IOException {
        Config config = competeConfig(props);
        EnvConfig envConfig = EnvConfig.compete().toBuilder().apply(props).build();
        log.info("{}", config);
        log.info("{}", envConfig);

        CompeteTrainer trainer = new CompeteTrainer(config, envConfig);
        trainer.train();
        logCompeteEvaluation(trainer.evaluate(EVALUATION_EPISODES));

        export(trainer.getAgent1(), outputDir, "blob1");
        export(trainer.getAgent2(), outputDir, "blob2");
        ParameterJson.writeEnvConfig(envConfig, CompeteEnv.STATE_SIZE, Action.COUNT, new File(outputDir, "env_config.json"));
    }

    private static void runHarvestDemo(Properties props, File modelDir) throws IOException {
        Config config = Config.fromProperties(props);
        HarvestTrainer trainer = new HarvestTrainer(config, EnvConfig.harvest().toBuilder().apply(props).build());
        loadAgent(trainer.getAgent(), modelDir, "blob");
        logHarvestEvaluation(trainer.evaluate(EVALUATION_EPISODES));
    }

    private static void runCompeteDemo(Properties props, File modelDir) throws IOException {
        Config config = competeConfig(props);
        CompeteTrainer trainer = new CompeteTrainer(config, EnvConfig.compete().toBuilder().apply(props).build());
        loadAgent(trainer.getAgent1(), modelDir, "blob1");
        loadAgent(trainer.getAgent2(), modelDir, "blob2");
        logCompeteEvaluation(trainer.evaluate(EVALUATION_EPISODES));
    }

    // Prefers the DL4J model archive, falls back to the exported weights
    static void loadAgent(DQNAgent agent, File modelDir, String name) throws IOException {
        File model = new File(modelDir, name + "_model.zip");
        File weights = new File(modelDir, name + "_weights.json");
        if (model.isFile()) {
            agent.loadModel(model.getPath());
        } else if (weights.isFile()) {
            agent.importParameters(ParameterJson.read(weights));
            log.info("Weights loaded from {}", weights);
        } else {
            throw new FileNotFoundException("neither " + model + " nor " + weights + " exists");
        }
    }

    private static void logHarvestEvaluation(List<EpisodeStats> evaluation) {
        for (EpisodeStats stats : evaluation) {
            log.info("{}", stats);
        }
        double avgLength = evaluation.stream().mapToInt(s -> s.length).average().orElse(0);
        double avgFoods = evaluation.stream().mapToInt(s -> s.pickups).average().orElse(0);
        log.info(String.format("Greedy evaluation over %d episodes: avg length %.1f, avg foods %.1f",
                evaluation.size(), avgLength, avgFoods));
    }

    private static void logCompeteEvaluation(List<CompeteEpisodeStats> evaluation) {
        for (CompeteEpisodeStats stats : evaluation) {
            log.info("{}", stats);
        }
        long blob1Wins = evaluation.stream().filter(s -> s.winner == 1).count();
        long blob2Wins = evaluation.stream().filter(s -> s.winner == 2).count();
        log.info("Greedy evaluation over {} episodes: blob1 won {}, blob2 won {}", evaluation.size(), blob1Wins, blob2Wins);
    }

    private static void export(DQNAgent agent, File outputDir, String name) throws IOException {
        if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
            throw new IOException("Could not create output directory " + outputDir);
        }
        agent.saveModel(new File(outputDir, name + "_model.zip").getPath());
        File weights = new File(outputDir, name + "_weights.json");
        ParameterJson.write(agent.exportParameters(), weights);
        log.info("Weights exported to {}", weights);
    }
}
