package io.github.tanejagagan.access.server;

public class NoSuchPolicyException extends Exception {
    private final String dataSourceIdentifier;

    public NoSuchPolicyException(String dataSourceIdentifier) {
        super(String.format("Policy for data source %s Not Found", dataSourceIdentifier));
        this.dataSourceIdentifier = dataSourceIdentifier;
    }

    public String getDataSourceIdentifier() {
        return dataSourceIdentifier;
    }
}
