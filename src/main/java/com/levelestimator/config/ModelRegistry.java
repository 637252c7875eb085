package com.levelestimator.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.levelestimator.LevelEstimator;
import com.levelestimator.model.PkModel;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable lookup tables for the PK models: parameters, patch wear durations,
 * preferred dosing intervals and the ester + method routes that resolve to a
 * model key. Loaded once from {@code pk_models.json} and handed to each component.
 */
public final class ModelRegistry {
    private static final Gson GSON = new Gson();
    private static final String DEFAULT_RESOURCE = "/pk_models.json";
    private static final List<Double> DEFAULT_INTERVALS = List.of(7.0);

    /**
     * Resolution of one ester + method pair. A route with a long-interval model
     * switches to it when the dosing interval exceeds {@code longIntervalAbove}.
     */
    public static final class Route {
        public final String ester;
        public final String method;
        public final String model;
        public final String longIntervalModel;
        public final double longIntervalAbove;

        public Route(String ester, String method, String model) {
            this(ester, method, model, null, 0.0);
        }

        public Route(String ester, String method, String model, String longIntervalModel,
                     double longIntervalAbove) {
            this.ester = ester;
            this.method = method;
            this.model = model;
            this.longIntervalModel = longIntervalModel;
            this.longIntervalAbove = longIntervalAbove;
        }

        String modelFor(double intervalDays) {
            if (longIntervalModel != null && intervalDays > longIntervalAbove) {
                return longIntervalModel;
            }
            return model;
        }
    }

    // Gson binding for the resource file
    private static final class Document {
        Map<String, String> esters;
        Map<String, String> methods;
        Map<String, ModelEntry> models;
        Map<String, List<Double>> preferredIntervals;
        List<Route> routes;
    }

    private static final class ModelEntry {
        double d;
        double k1;
        double k2;
        double k3;
        double wearDays;
    }

    private final Map<String, PkModel> models;
    private final Map<String, List<Double>> preferredIntervals;
    private final List<Route> routes;
    private final Map<String, String> esterNames;
    private final Map<String, String> methodNames;

    public ModelRegistry(Map<String, PkModel> models, Map<String, List<Double>> preferredIntervals,
                         List<Route> routes) {
        this(models, preferredIntervals, routes, Map.of(), Map.of());
    }

    public ModelRegistry(Map<String, PkModel> models, Map<String, List<Double>> preferredIntervals,
                         List<Route> routes, Map<String, String> esterNames, Map<String, String> methodNames) {
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        Map<String, List<Double>> intervals = new LinkedHashMap<>();
        preferredIntervals.forEach((key, list) -> intervals.put(key, List.copyOf(list)));
        this.preferredIntervals = Collections.unmodifiableMap(intervals);
        this.routes = List.copyOf(routes);
        this.esterNames = Map.copyOf(esterNames);
        this.methodNames = Map.copyOf(methodNames);
    }

    /**
     * Registry built from the bundled model table.
     */
    public static ModelRegistry loadDefault() {
        try (InputStream in = ModelRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing model resource " + DEFAULT_RESOURCE);
            }
            return load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model resource " + DEFAULT_RESOURCE, e);
        }
    }

    public static ModelRegistry load(Reader reader) {
        Document doc;
        try {
            doc = GSON.fromJson(reader, Document.class);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Malformed model table", e);
        }
        if (doc == null || doc.models == null) {
            throw new IllegalStateException("Model table has no models");
        }

        Map<String, PkModel> models = new LinkedHashMap<>();
        doc.models.forEach((key, e) -> models.put(key, new PkModel(key, e.d, e.k1, e.k2, e.k3, e.wearDays)));

        ModelRegistry registry = new ModelRegistry(models,
                doc.preferredIntervals != null ? doc.preferredIntervals : Map.of(),
                doc.routes != null ? doc.routes : List.of(),
                doc.esters != null ? doc.esters : Map.of(),
                doc.methods != null ? doc.methods : Map.of());
        LevelEstimator.LOGGER.debug("Loaded {} PK models and {} routes", models.size(), registry.routes.size());
        return registry;
    }

    /**
     * @return the model for {@code key}, or null if the key is unknown
     */
    public PkModel model(String key) {
        return key == null ? null : models.get(key);
    }

    public boolean contains(String key) {
        return key != null && models.containsKey(key);
    }

    public Map<String, PkModel> models() {
        return models;
    }

    /**
     * Intervals in order of clinical preference; {@code [7.0]} for models without a list.
     */
    public List<Double> preferredIntervals(String key) {
        return preferredIntervals.getOrDefault(key, DEFAULT_INTERVALS);
    }

    /**
     * Resolve ester + method (and the interval, for patches) to a model key.
     *
     * @return the model key, or null if the combination is not recognized
     */
    public String resolveModelKey(String ester, String method, double intervalDays) {
        Route route = route(ester, method);
        return route == null ? null : route.modelFor(intervalDays);
    }

    /**
     * Model used when suggesting a regimen: the route's primary model, i.e. the
     * twice-weekly patch for patches.
     */
    public String regimenModelKey(String ester, String method) {
        Route route = route(ester, method);
        return route == null ? null : route.model;
    }

    public boolean isCombinationSupported(String ester, String method) {
        Route route = route(ester, method);
        if (route == null) {
            return false;
        }
        return contains(route.model) && (route.longIntervalModel == null || contains(route.longIntervalModel));
    }

    public static String doseUnits(String method) {
        return "patch".equals(method) ? "mcg/day" : "mg";
    }

    public String esterName(String ester) {
        return esterNames.getOrDefault(ester, ester);
    }

    public String methodName(String method) {
        return methodNames.getOrDefault(method, method);
    }

    public List<String> supportedCombinations() {
        List<String> result = new ArrayList<>();
        for (Route route : routes) {
            if (isCombinationSupported(route.ester, route.method)) {
                result.add(route.ester + " " + route.method);
            }
        }
        return result;
    }

    private Route route(String ester, String method) {
        for (Route route : routes) {
            if (route.ester.equals(ester) && route.method.equals(method)) {
                return route;
            }
        }
        return null;
    }
}
