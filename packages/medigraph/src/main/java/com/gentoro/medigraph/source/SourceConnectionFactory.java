package com.gentoro.medigraph.source;

import com.gentoro.medigraph.ConfigurationProvider;
import com.gentoro.medigraph.exception.ConfigurationException;
import com.gentoro.medigraph.exception.SourceUnavailableException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Iterator;
import java.util.Objects;
import java.util.Properties;
import org.apache.commons.configuration2.Configuration;

/**
 * Opens JDBC connections to the warehouse. When multi-factor authentication is enabled, the
 * one-time passcode collected from the operator is passed as an extra connection property
 * ({@code passcode} for Snowflake).
 */
public class SourceConnectionFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.medigraph.logging.LoggingService.getLogger(SourceConnectionFactory.class);

  private final String url;
  private final Properties baseProperties;
  private final boolean mfaEnabled;
  private final String mfaProperty;

  public SourceConnectionFactory(
      String url, Properties baseProperties, boolean mfaEnabled, String mfaProperty) {
    this.url = Objects.requireNonNull(url, "url");
    this.baseProperties = new Properties();
    this.baseProperties.putAll(Objects.requireNonNull(baseProperties, "baseProperties"));
    this.mfaEnabled = mfaEnabled;
    this.mfaProperty = mfaProperty != null && !mfaProperty.isBlank() ? mfaProperty : "passcode";
  }

  /**
   * Build from {@code source.*}. Missing URL or credentials raise {@link ConfigurationException}
   * before any connection attempt.
   */
  public static SourceConnectionFactory fromConfiguration(Configuration configuration) {
    ConfigurationProvider.requireValues(
        configuration, "source.jdbc.url", "source.jdbc.user", "source.jdbc.password");
    Properties props = new Properties();
    props.setProperty("user", configuration.getString("source.jdbc.user"));
    props.setProperty("password", configuration.getString("source.jdbc.password"));
    Configuration extra = configuration.subset("source.jdbc.properties");
    for (Iterator<String> it = extra.getKeys(); it.hasNext(); ) {
      String key = it.next();
      String value = extra.getString(key);
      if (value != null && !value.isBlank() && !value.contains("${")) {
        props.setProperty(key.replace("..", "."), value);
      }
    }
    return new SourceConnectionFactory(
        configuration.getString("source.jdbc.url"),
        props,
        configuration.getBoolean("source.mfa.enabled", true),
        configuration.getString("source.mfa.property", "passcode"));
  }

  public boolean requiresPasscode() {
    return mfaEnabled;
  }

  /**
   * Open a new connection. The caller owns it and must close it.
   *
   * @param passcode one-time secondary factor; required when MFA is enabled, ignored otherwise
   */
  public Connection open(String passcode) {
    Properties props = new Properties();
    props.putAll(baseProperties);
    if (mfaEnabled) {
      if (passcode == null || passcode.isBlank()) {
        throw new ConfigurationException("A one-time passcode is required to connect to the source");
      }
      props.setProperty(mfaProperty, passcode.trim());
    }
    log.info("Connecting to source {}", url);
    try {
      Connection connection = DriverManager.getConnection(url, props);
      log.info("Source connection established");
      return connection;
    } catch (SQLException e) {
      throw new SourceUnavailableException("Unable to connect to source " + url, e);
    }
  }
}
