package dqnblob;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ParameterSnapshot {
    private final Map<String, LayerParameters> layers;

    public ParameterSnapshot(Map<String, LayerParameters> layers) {
        this.layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
    }

    public Map<String, LayerParameters> getLayers() {
        return layers;
    }

    public LayerParameters layer(String name) throws SnapshotException {
        LayerParameters layer = layers.get(name);
        if (layer == null) {
            throw new SnapshotException("Snapshot has no layer '" + name + "', found " + layers.keySet());
        }
        return layer;
    }

    public int stateSize() {
        LayerParameters first = layers.get(QNetworkBuilder.LAYER_NAMES[0]);
        return first == null ? 0 : first.inputs();
    }

    public int actionSize() {
        LayerParameters last = layers.get(QNetworkBuilder.LAYER_NAMES[QNetworkBuilder.LAYER_NAMES.length - 1]);
        return last == null ? 0 : last.outputs();
    }
}
