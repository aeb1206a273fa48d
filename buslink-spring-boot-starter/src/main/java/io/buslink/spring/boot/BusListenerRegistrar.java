package io.buslink.spring.boot;

import io.buslink.BusClient;
import io.buslink.BusException;
import io.buslink.client.EventListener;
import io.buslink.message.EventKey;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scans for beans annotated with {@link BusListener} and starts listening on the
 * {@link BusClient} for each.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton},
 * by which time the client is open.
 *
 * @see BusListener
 */
public class BusListenerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final BusClient busClient;

    public BusListenerRegistrar(ListableBeanFactory beanFactory, BusClient busClient) {
        this.beanFactory = beanFactory;
        this.busClient = busClient;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(BusListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventListener listener)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @BusListener must implement EventListener, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            BusListener annotation = AnnotationUtils.findAnnotation(bean.getClass(), BusListener.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @BusListener annotation on " + bean.getClass().getName());
            }

            String listenerName = annotation.name().isEmpty() ? beanName : annotation.name();
            List<EventKey> events = resolveEvents(beanName, annotation);
            try {
                busClient.listen(events, listener, listenerName);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BeanCreationException(beanName, "Interrupted while registering listener", e);
            } catch (BusException e) {
                throw new BeanCreationException(beanName,
                        "Failed to register @BusListener " + listenerName + ": " + e.getMessage(), e);
            }
        }
    }

    private List<EventKey> resolveEvents(String beanName, BusListener annotation) {
        List<EventKey> events = new ArrayList<>();
        for (String event : annotation.events()) {
            try {
                events.add(EventKey.parse(event));
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName,
                        "@BusListener event '" + event + "' must be in the form <api>.<event>", e);
            }
        }
        return events;
    }
}
