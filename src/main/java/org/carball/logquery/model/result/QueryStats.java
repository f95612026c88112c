package org.carball.logquery.model.result;

public record QueryStats(long rowsRead, long bytesRead, double elapsedMillis) {

    public static QueryStats empty() {
        return new QueryStats(0, 0, 0.0);
    }
}
