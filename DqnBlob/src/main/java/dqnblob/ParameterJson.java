package dqnblob;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// {"fc1": {"weight": [[...]], "bias": [...]}, "fc2": ..., "fc3": ...}, weights out x in, in layer order
public final class ParameterJson {

    private ParameterJson() {
    }

    @SuppressWarnings("unchecked")
    public static void write(ParameterSnapshot snapshot, File file) throws IOException {
        Map<String, Object> root = new LinkedHashMap<>();
        for (Map.Entry<String, LayerParameters> entry : snapshot.getLayers().entrySet()) {
            LayerParameters layer = entry.getValue();
            JSONArray weight = new JSONArray();
            for (double[] row : layer.getWeight()) {
                weight.add(toArray(row));
            }
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("weight", weight);
            json.put("bias", toArray(layer.getBias()));
            root.put(entry.getKey(), json);
        }
        writeJson(root, file);
    }

    // SnapshotException when the file is not JSON or a layer is missing or malformed
    public static ParameterSnapshot read(File file) throws IOException {
        Object parsed;
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            parsed = new JSONParser().parse(reader);
        } catch (ParseException e) {
            throw new SnapshotException("Malformed parameter file " + file + ": " + e, e);
        }
        if (!(parsed instanceof JSONObject)) {
            throw new SnapshotException("Parameter file " + file + " does not hold a JSON object");
        }
        JSONObject root = (JSONObject) parsed;

        Map<String, LayerParameters> layers = new LinkedHashMap<>();
        for (String name : QNetworkBuilder.LAYER_NAMES) {
            Object layer = root.get(name);
            if (!(layer instanceof JSONObject)) {
                throw new SnapshotException("Parameter file " + file + " has no layer '" + name + "'");
            }
            JSONObject json = (JSONObject) layer;
            double[][] weight = toMatrix(json.get("weight"), name + ".weight");
            double[] bias = toVector(json.get("bias"), name + ".bias");
            try {
                layers.put(name, new LayerParameters(weight, bias));
            } catch (IllegalArgumentException e) {
                throw new SnapshotException("Layer " + name + ": " + e.getMessage(), e);
            }
        }
        return new ParameterSnapshot(layers);
    }

    // The knobs an inference front end needs to replay the environment
    public static void writeEnvConfig(EnvConfig config, int stateSize, int actionSize, File file) throws IOException {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("state_size", stateSize);
        json.put("action_size", actionSize);
        json.put("map_size", config.mapSize);
        json.put("agent_radius", config.agentRadius);
        json.put("pellet_radius", config.pelletRadius);
        json.put("initial_mass", config.initialMass);
        json.put("min_mass", config.minMass);
        json.put("mass_decay_rate", config.massDecayRate);
        json.put("mass_steal_rate", config.massStealRate);
        json.put("food_mass_gain", config.foodMassGain);
        json.put("movement_speed", config.movementSpeed);
        json.put("turn_rate", config.turnRate);
        json.put("max_foods", config.pelletCount);
        json.put("max_steps", config.maxSteps);
        writeJson(json, file);
    }

    private static void writeJson(Map<String, Object> json, File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            Files.createDirectories(parent.toPath());
        }
        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            JSONValue.writeJSONString(json, writer);
        }
    }

    @SuppressWarnings("unchecked")
    private static JSONArray toArray(double[] values) {
        JSONArray array = new JSONArray();
        for (double v : values) {
            array.add(v);
        }
        return array;
    }

    private static double[][] toMatrix(Object value, String what) throws SnapshotException {
        if (!(value instanceof List)) {
            throw new SnapshotException(what + " is missing or not an array");
        }
        List<?> rows = (List<?>) value;
        double[][] matrix = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            matrix[i] = toVector(rows.get(i), what + "[" + i + "]");
        }
        return matrix;
    }

    private static double[] toVector(Object value, String what) throws SnapshotException {
        if (!(value instanceof List)) {
            throw new SnapshotException(what + " is missing or not an array");
        }
        List<?> items = (List<?>) value;
        double[] vector = new double[items.size()];
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (!(item instanceof Number)) {
                throw new SnapshotException(what + "[" + i + "] is not a number: " + item);
            }
            vector[i] = ((Number) item).doubleValue();
        }
        return vector;
    }
}
