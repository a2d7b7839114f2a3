package com.questrail.unitbus.jobs;

import java.util.Objects;

/**
 * Request to build an image from a source repository.
 *
 * @param requestId    identifies the request; names the build unit
 * @param source       source repository URL
 * @param baseImage    builder image the source is combined with
 * @param tag          tag of the resulting image
 * @param runtimeImage image for an extended build; {@code null} for none
 * @param clean        whether to build without incremental artifacts
 * @param verbose      whether the builder logs at DEBUG level
 */
public record BuildImageRequest(
    String requestId,
    String source,
    String baseImage,
    String tag,
    String runtimeImage,
    boolean clean,
    boolean verbose
) {
    public BuildImageRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(baseImage, "baseImage");
        Objects.requireNonNull(tag, "tag");
        if (requestId.isEmpty()) {
            throw new IllegalArgumentException("requestId must not be empty");
        }
    }

    /**
     * Name of the transient unit that runs the build.
     */
    public String unitName() {
        return "build-" + requestId + ".service";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String source;
        private String baseImage;
        private String tag;
        private String runtimeImage;
        private boolean clean;
        private boolean verbose;

        public Builder withRequestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder withSource(String source) {
            this.source = source;
            return this;
        }

        public Builder withBaseImage(String baseImage) {
            this.baseImage = baseImage;
            return this;
        }

        public Builder withTag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder withRuntimeImage(String runtimeImage) {
            this.runtimeImage = runtimeImage;
            return this;
        }

        public Builder withClean(boolean clean) {
            this.clean = clean;
            return this;
        }

        public Builder withVerbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public BuildImageRequest build() {
            return new BuildImageRequest(requestId, source, baseImage, tag, runtimeImage, clean, verbose);
        }
    }
}
