package io.spatialepi.transdist.kernel.estimate;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.spatialepi.transdist.api.DomainException;
import io.spatialepi.transdist.api.json.TransdistGsonConfig;
import io.spatialepi.transdist.kernel.concurrent.TrialExecutor;
import io.spatialepi.transdist.kernel.gentime.GenerationTimeFamily;
import io.spatialepi.transdist.kernel.weights.TimeOrdering;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * JSON form of {@link EstimatorOptions} plus the worker pool settings.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every field is optional except the generation time, given either as
 * moments or as an explicit mass vector:
 *
 * <pre>{@code
 * {
 *   "gen_t_mean": 5.0,
 *   "gen_t_sd": 2.0,
 *   "gen_t_family": "GAMMA",        // or NORMAL (default), any case
 *   "gen_t_density": [0, 0.6, 0.4], // instead of mean/sd
 *   "t1": 0,
 *   "t2": 120,
 *   "max_sep": 30,
 *   "max_dist": 50000.0,
 *   "n_transtree_reps": 50,
 *   "time_ordering": "STRICT",
 *   "mean_equals_sd": false,
 *   "boot_iter": 200,
 *   "ci_low": 0.025,
 *   "ci_high": 0.975,
 *   "min_cases": 10,
 *   "seed": 42,
 *   "parallel": true,
 *   "n_cores": 8
 * }
 * }</pre>
 *
 * <p>Absent fields take the {@link EstimatorOptions} defaults. Enum names
 * match without regard to case; an unknown name is rejected when the
 * configuration is read.
 */
public class EstimatorConfig {

    private static final Gson GSON = TransdistGsonConfig.gson();

    @SerializedName("gen_t_mean")
    private Double genTMean;

    @SerializedName("gen_t_sd")
    private Double genTSd;

    @SerializedName("gen_t_family")
    private String genTFamily;

    @SerializedName("gen_t_density")
    private double[] genTDensity;

    @SerializedName("t1")
    private Integer t1;

    @SerializedName("t2")
    private Integer t2;

    @SerializedName("max_sep")
    private Integer maxSep;

    @SerializedName("max_dist")
    private Double maxDist;

    @SerializedName("n_transtree_reps")
    private Integer nTranstreeReps;

    @SerializedName("time_ordering")
    private String timeOrdering;

    @SerializedName("mean_equals_sd")
    private Boolean meanEqualsSd;

    @SerializedName("boot_iter")
    private Integer bootIter;

    @SerializedName("ci_low")
    private Double ciLow;

    @SerializedName("ci_high")
    private Double ciHigh;

    @SerializedName("min_cases")
    private Integer minCases;

    @SerializedName("seed")
    private Long seed;

    @SerializedName("parallel")
    private Boolean parallel;

    @SerializedName("n_cores")
    private Integer nCores;

    public EstimatorConfig() {
    }

    public static EstimatorConfig fromJson(String json) {
        return parse(() -> GSON.fromJson(json, EstimatorConfig.class));
    }

    public static EstimatorConfig fromJson(Reader reader) {
        return parse(() -> GSON.fromJson(reader, EstimatorConfig.class));
    }

    /**
     * Reads a configuration file.
     *
     * @param path the JSON file
     * @return the parsed configuration
     * @throws IOException if the file cannot be read
     */
    public static EstimatorConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    private static EstimatorConfig parse(Supplier<EstimatorConfig> read) {
        EstimatorConfig config;
        try {
            config = read.get();
        } catch (JsonParseException e) {
            throw new DomainException("Malformed estimator configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new DomainException("Empty estimator configuration");
        }
        config.getGenTFamily();
        config.getTimeOrdering();
        return config;
    }

    /// Matches an enum constant by name, ignoring case.
    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        if (value == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DomainException(key + " must be one of " + Arrays.toString(type.getEnumConstants())
                + ", got: \"" + value + "\"", e);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Converts this configuration to validated options.
     *
     * @throws DomainException if no generation time is given, both forms are
     *     given, or any value is out of range
     */
    public EstimatorOptions toOptions() {
        EstimatorOptions.Builder builder = EstimatorOptions.builder();

        boolean hasMoments = genTMean != null || genTSd != null;
        if (genTDensity != null && hasMoments) {
            throw new DomainException("Give either gen_t_density or gen_t_mean/gen_t_sd, not both");
        }
        if (genTDensity != null) {
            builder.genTimeVector(genTDensity);
        } else if (genTMean != null && genTSd != null) {
            GenerationTimeFamily family = getGenTFamily();
            builder.genTime(family != null ? family : GenerationTimeFamily.NORMAL, genTMean, genTSd);
        } else {
            throw new DomainException("gen_t_mean and gen_t_sd, or gen_t_density, are required");
        }

        if (t1 != null) builder.t1(t1);
        if (t2 != null) builder.t2(t2);
        if (maxSep != null) builder.maxSep(maxSep);
        if (maxDist != null) builder.maxDist(maxDist);
        if (nTranstreeReps != null) builder.nTranstreeReps(nTranstreeReps);
        TimeOrdering ordering = getTimeOrdering();
        if (ordering != null) builder.timeOrdering(ordering);
        if (meanEqualsSd != null) builder.meanEqualsSd(meanEqualsSd);
        if (bootIter != null) builder.bootIter(bootIter);
        if (ciLow != null) builder.ciLow(ciLow);
        if (ciHigh != null) builder.ciHigh(ciHigh);
        if (minCases != null) builder.minCases(minCases);
        if (seed != null) builder.seed(seed);
        return builder.build();
    }

    /**
     * Creates the executor this configuration asks for: sequential unless
     * {@code parallel} is true, in which case {@code n_cores} workers or half
     * the available processors.
     */
    public TrialExecutor createExecutor() {
        if (parallel == null || !parallel) {
            return TrialExecutor.sequential();
        }
        if (nCores == null) {
            return TrialExecutor.parallel();
        }
        if (nCores < 1) {
            throw new DomainException("n_cores must be at least 1, got: " + nCores);
        }
        return TrialExecutor.parallel(nCores);
    }

    public Double getGenTMean() {
        return genTMean;
    }

    public void setGenTMean(Double genTMean) {
        this.genTMean = genTMean;
    }

    public Double getGenTSd() {
        return genTSd;
    }

    public void setGenTSd(Double genTSd) {
        this.genTSd = genTSd;
    }

    /**
     * @throws DomainException if {@code gen_t_family} names no family
     */
    public GenerationTimeFamily getGenTFamily() {
        return parseEnum(GenerationTimeFamily.class, "gen_t_family", genTFamily);
    }

    public void setGenTFamily(GenerationTimeFamily genTFamily) {
        this.genTFamily = genTFamily == null ? null : genTFamily.name();
    }

    public double[] getGenTDensity() {
        return genTDensity;
    }

    public void setGenTDensity(double[] genTDensity) {
        this.genTDensity = genTDensity;
    }

    public Integer getT1() {
        return t1;
    }

    public void setT1(Integer t1) {
        this.t1 = t1;
    }

    public Integer getT2() {
        return t2;
    }

    public void setT2(Integer t2) {
        this.t2 = t2;
    }

    public Integer getMaxSep() {
        return maxSep;
    }

    public void setMaxSep(Integer maxSep) {
        this.maxSep = maxSep;
    }

    public Double getMaxDist() {
        return maxDist;
    }

    public void setMaxDist(Double maxDist) {
        this.maxDist = maxDist;
    }

    public Integer getNTranstreeReps() {
        return nTranstreeReps;
    }

    public void setNTranstreeReps(Integer nTranstreeReps) {
        this.nTranstreeReps = nTranstreeReps;
    }

    /**
     * @throws DomainException if {@code time_ordering} names no ordering
     */
    public TimeOrdering getTimeOrdering() {
        return parseEnum(TimeOrdering.class, "time_ordering", timeOrdering);
    }

    public void setTimeOrdering(TimeOrdering timeOrdering) {
        this.timeOrdering = timeOrdering == null ? null : timeOrdering.name();
    }

    public Boolean getMeanEqualsSd() {
        return meanEqualsSd;
    }

    public void setMeanEqualsSd(Boolean meanEqualsSd) {
        this.meanEqualsSd = meanEqualsSd;
    }

    public Integer getBootIter() {
        return bootIter;
    }

    public void setBootIter(Integer bootIter) {
        this.bootIter = bootIter;
    }

    public Double getCiLow() {
        return ciLow;
    }

    public void setCiLow(Double ciLow) {
        this.ciLow = ciLow;
    }

    public Double getCiHigh() {
        return ciHigh;
    }

    public void setCiHigh(Double ciHigh) {
        this.ciHigh = ciHigh;
    }

    public Integer getMinCases() {
        return minCases;
    }

    public void setMinCases(Integer minCases) {
        this.minCases = minCases;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public Boolean getParallel() {
        return parallel;
    }

    public void setParallel(Boolean parallel) {
        this.parallel = parallel;
    }

    public Integer getNCores() {
        return nCores;
    }

    public void setNCores(Integer nCores) {
        this.nCores = nCores;
    }
}
