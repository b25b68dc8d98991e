package io.vena.changestream.mongo;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.junit.jupiter.api.parallel.ResourceLock;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.junit.jupiter.api.parallel.ResourceAccessMode.READ;

/**
 * Indicates that a test is going to use {@link MongoService}.
 * Such tests are skipped when Docker isn't available.
 *
 * <p>
 * Each test class should use a distinct database name so that
 * classes can run in parallel on the same MongoDB container.
 */
@Target({ ElementType.ANNOTATION_TYPE, ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
@ResourceLock(value="mongoContainer", mode= READ)
@Testcontainers(disabledWithoutDocker = true)
public @interface UsesMongoService {
}
