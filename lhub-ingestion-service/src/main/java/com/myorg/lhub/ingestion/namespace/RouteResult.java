package com.myorg.lhub.ingestion.namespace;

public record RouteResult(RoutingDecision decision, RouteRejection rejection, String message) {

    public static RouteResult routed(RoutingDecision decision) {
        return new RouteResult(decision, null, null);
    }

    public static RouteResult rejected(RouteRejection rejection, String message) {
        return new RouteResult(null, rejection, message);
    }

    public boolean isRouted() {
        return decision != null;
    }
}
