package me.golemcore.mindbase.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Vector comparison used by the store's similarity query. Each operator maps
 * its distance to a similarity where larger means closer.
 */
public enum DistanceOperator {

    /**
     * 1 - cosine distance, i.e. the cosine similarity in [-1, 1].
     */
    COSINE {
        @Override
        public double similarity(float[] a, float[] b) {
            checkLengths(a, b);
            double dotProduct = 0;
            double normA = 0;
            double normB = 0;

            for (int i = 0; i < a.length; i++) {
                dotProduct += a[i] * b[i];
                normA += a[i] * a[i];
                normB += b[i] * b[i];
            }

            if (normA == 0 || normB == 0) {
                return 0;
            }

            return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
        }
    },

    /**
     * Raw dot product, meaningful for normalized embeddings.
     */
    INNER_PRODUCT {
        @Override
        public double similarity(float[] a, float[] b) {
            checkLengths(a, b);
            double dotProduct = 0;
            for (int i = 0; i < a.length; i++) {
                dotProduct += a[i] * b[i];
            }
            return dotProduct;
        }
    },

    /**
     * 1 / (1 + L2 distance).
     */
    EUCLIDEAN {
        @Override
        public double similarity(float[] a, float[] b) {
            checkLengths(a, b);
            double sum = 0;
            for (int i = 0; i < a.length; i++) {
                double diff = a[i] - b[i];
                sum += diff * diff;
            }
            return 1.0 / (1.0 + Math.sqrt(sum));
        }
    };

    public abstract double similarity(float[] a, float[] b);

    private static void checkLengths(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same length");
        }
    }
}
