package config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hibernate.HibernateException;
import org.hibernate.SessionFactory;
import org.hibernate.cfg.Configuration;

/**
 * Hibernate Utility class:
 * - Build a SessionFactory from {@link StoreSettings}
 * - One factory per run, closed by the caller
 */
public class HibernateUtil {

    private static final Logger logger = LogManager.getLogger(HibernateUtil.class);

    private HibernateUtil() {
    }

    public static SessionFactory buildSessionFactory(StoreSettings settings) {
        try {
            Configuration config = new Configuration();

            // Database connection
            if (settings.getDriverClass() != null) {
                config.setProperty("hibernate.connection.driver_class", settings.getDriverClass());
            }
            config.setProperty("hibernate.connection.url", settings.getUrl());
            config.setProperty("hibernate.connection.username", settings.getUsername());
            config.setProperty("hibernate.connection.password",
                    settings.getPassword() == null ? "" : settings.getPassword());

            // Hibernate settings
            if (settings.getDialect() != null) {
                config.setProperty("hibernate.dialect", settings.getDialect());
            }
            config.setProperty("hibernate.show_sql", String.valueOf(settings.isShowSql()));
            config.setProperty("hibernate.format_sql", "true");
            config.setProperty("hibernate.hbm2ddl.auto", settings.getSchemaAction());
            config.setProperty("hibernate.jdbc.batch_size", String.valueOf(settings.getJdbcBatchSize()));
            config.setProperty("hibernate.order_inserts", "true");
            config.setProperty("hibernate.connection.autocommit", "false");

            // Mapping entity classes
            config.addAnnotatedClass(model.Users.class);
            config.addAnnotatedClass(model.Chat.class);
            config.addAnnotatedClass(model.Membership.class);
            config.addAnnotatedClass(model.Message.class);

            SessionFactory sessionFactory = config.buildSessionFactory();
            logger.info("SessionFactory created for role {} at {}", settings.getRole(), settings.getUrl());
            return sessionFactory;

        } catch (HibernateException ex) {
            throw new ConfigurationException("SessionFactory creation failed for " + settings.getUrl(), ex);
        }
    }

    public static void shutdown(SessionFactory sessionFactory) {
        if (sessionFactory != null && sessionFactory.isOpen()) {
            sessionFactory.close();
            logger.info("SessionFactory closed.");
        }
    }
}
