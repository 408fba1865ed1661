package com.finplan.mgraph.tensor;

import java.util.HashMap;
import java.util.Map;

/**
 * Capture and restore of tensor values.
 *
 * <p>
 * Used for what-if analysis: capture, perturb inputs, recompute, read the
 * outcome, then restore so the model is left exactly as it was. Tensors that
 * did not exist at capture time are dropped on restore.
 */
public final class TensorSnapshot {
    private final Map<String, Tensor> captured;

    private TensorSnapshot(Map<String, Tensor> captured) {
        this.captured = captured;
    }

    public static TensorSnapshot capture(TensorStore store) {
        Map<String, Tensor> copy = new HashMap<>();
        for (String id : store.ids()) {
            Tensor t = store.get(id);
            if (t != null)
                copy.put(id, t.copy());
        }
        return new TensorSnapshot(copy);
    }

    public void restore(TensorStore store) {
        for (String id : store.ids().toArray(new String[0])) {
            if (!captured.containsKey(id))
                store.remove(id);
        }
        for (Map.Entry<String, Tensor> e : captured.entrySet()) {
            Tensor live = store.get(e.getKey());
            if (live != null && live.hasShape(e.getValue().shape()))
                live.copyFrom(e.getValue());
            else
                store.put(e.getKey(), e.getValue().copy());
        }
    }

    public int size() {
        return captured.size();
    }
}
