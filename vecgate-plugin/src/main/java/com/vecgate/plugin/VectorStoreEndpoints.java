package com.vecgate.plugin;

import java.util.List;

/**
 * Endpoint templates a provider exposes, grouped by access type. Paths contain placeholders such as
 * {@code {collection_name}}; used by the gateway's routing and permission checks.
 */
public final class VectorStoreEndpoints {

    /** One endpoint template: HTTP method and path. */
    public static final class Endpoint {
        private final String method;
        private final String path;

        public Endpoint(String method, String path) {
            this.method = method;
            this.path = path;
        }

        public String getMethod() {
            return method;
        }

        public String getPath() {
            return path;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Endpoint)) return false;
            Endpoint other = (Endpoint) o;
            return method.equals(other.method) && path.equals(other.path);
        }

        @Override
        public int hashCode() {
            return 31 * method.hashCode() + path.hashCode();
        }

        @Override
        public String toString() {
            return method + " " + path;
        }
    }

    private final List<Endpoint> read;
    private final List<Endpoint> write;

    public VectorStoreEndpoints(List<Endpoint> read, List<Endpoint> write) {
        this.read = read != null ? List.copyOf(read) : List.of();
        this.write = write != null ? List.copyOf(write) : List.of();
    }

    public List<Endpoint> getRead() {
        return read;
    }

    public List<Endpoint> getWrite() {
        return write;
    }
}
