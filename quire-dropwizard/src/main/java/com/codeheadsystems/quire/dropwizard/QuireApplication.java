package com.codeheadsystems.quire.dropwizard;

import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application serving the Quire auth API.
 * Start with {@code server config/config.yml}.
 */
public class QuireApplication extends Application<QuireConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new QuireApplication().run(args);
  }

  @Override
  public String getName() {
    return "quire";
  }

  @Override
  public void initialize(Bootstrap<QuireConfiguration> bootstrap) {
    // ${ENV_VAR:-default} substitution lets deployments override single keys.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new QuireBundle<>());
  }

  @Override
  public void run(QuireConfiguration configuration, Environment environment) {
    // Everything is registered by QuireBundle.
  }
}
