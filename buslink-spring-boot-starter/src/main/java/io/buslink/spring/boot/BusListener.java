package io.buslink.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a bus event listener.
 *
 * <p>The annotated bean must implement {@link io.buslink.client.EventListener}.
 *
 * <pre>{@code
 * @Component
 * @BusListener(name = "shipping", events = "shop.order_placed")
 * public class ShippingListener implements EventListener {
 *   public void onEvent(EventMessage message, Map<String, Object> kwargs) { ... }
 * }
 * }</pre>
 *
 * @see BusListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface BusListener {

    /**
     * Unique listener name. Defaults to the bean name.
     */
    String name() default "";

    /**
     * Events to listen for, each as {@code <api>.<event>}, e.g. {@code "shop.order_placed"}.
     */
    String[] events();
}
