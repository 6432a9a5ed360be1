package kz.qazmarka.mts.applier.metrics;

import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import javax.management.Attribute;
import javax.management.AttributeList;
import javax.management.AttributeNotFoundException;
import javax.management.DynamicMBean;
import javax.management.InstanceAlreadyExistsException;
import javax.management.InstanceNotFoundException;
import javax.management.InvalidAttributeValueException;
import javax.management.MBeanAttributeInfo;
import javax.management.MBeanException;
import javax.management.MBeanInfo;
import javax.management.MBeanRegistrationException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.NotCompliantMBeanException;
import javax.management.ObjectName;
import javax.management.ReflectionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JMX-обёртка над снимком счётчиков применителя.
 *
 * Набор атрибутов фиксируется по первому снимку при создании; значения читаются из свежего
 * снимка при каждом обращении. Имена атрибутов: ключи метрик, в которых всё, кроме
 * латиницы, цифр и '_', заменено на '_'. Только чтение.
 */
public final class ApplierMetricsJmx implements DynamicMBean {

    private static final Logger LOG = LoggerFactory.getLogger(ApplierMetricsJmx.class);
    private static final String OBJECT_NAME_BASE = "kz.qazmarka.mts:type=Applier,name=MtsMetrics";

    private final Supplier<Map<String, Long>> snapshotSupplier;
    /** Имя JMX-атрибута → ключ метрики. */
    private final Map<String, String> attrToKey;
    private final MBeanInfo mbeanInfo;

    private ApplierMetricsJmx(Supplier<Map<String, Long>> snapshotSupplier) {
        this.snapshotSupplier = Objects.requireNonNull(snapshotSupplier, "snapshotSupplier");
        Map<String, Long> snapshot = safeSnapshot();
        Map<String, String> mapping = new HashMap<>(snapshot.size());
        List<MBeanAttributeInfo> infos = new ArrayList<>(snapshot.size());
        for (String key : snapshot.keySet()) {
            String attr = uniqueName(normalize(key), mapping);
            mapping.put(attr, key);
            infos.add(new MBeanAttributeInfo(attr, Long.class.getName(),
                    "Метрика '" + key + "' (чтение)", true, false, false));
        }
        this.attrToKey = Collections.unmodifiableMap(mapping);
        this.mbeanInfo = new MBeanInfo(
                ApplierMetricsJmx.class.getName(),
                "Метрики параллельного применения репликации",
                infos.toArray(new MBeanAttributeInfo[0]),
                null,
                null,
                null);
    }

    /**
     * Регистрирует MBean в платформенном {@link MBeanServer}.
     *
     * @return имя MBean или {@code null}, если регистрация не удалась
     */
    public static ObjectName register(Supplier<Map<String, Long>> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        ApplierMetricsJmx mbean = new ApplierMetricsJmx(supplier);
        try {
            ObjectName name = new ObjectName(OBJECT_NAME_BASE);
            MBeanServer server = ManagementFactory.getPlatformMBeanServer();
            try {
                server.registerMBean(mbean, name);
                return name;
            } catch (InstanceAlreadyExistsException e) {
                // второй применитель в том же процессе
                ObjectName uid = new ObjectName(OBJECT_NAME_BASE + ",uid="
                        + Integer.toHexString(System.identityHashCode(mbean)));
                server.registerMBean(mbean, uid);
                return uid;
            }
        } catch (MalformedObjectNameException
                 | MBeanRegistrationException
                 | NotCompliantMBeanException
                 | InstanceAlreadyExistsException e) {
            LOG.warn("Не удалось зарегистрировать JMX-метрики применителя: {}", e.toString());
            return null;
        }
    }

    /** Снимает регистрацию; ошибка только логируется. */
    public static void unregisterQuietly(ObjectName name) {
        if (name == null) {
            return;
        }
        try {
            ManagementFactory.getPlatformMBeanServer().unregisterMBean(name);
        } catch (InstanceNotFoundException | MBeanRegistrationException e) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Снятие регистрации {} не выполнено: {}", name, e.toString());
            }
        }
    }

    /** Экземпляр без регистрации в MBeanServer, для модульных тестов. */
    static ApplierMetricsJmx createForTest(Supplier<Map<String, Long>> supplier) {
        return new ApplierMetricsJmx(supplier);
    }

    static String normalize(String key) {
        if (key == null || key.isEmpty()) {
            return "metric";
        }
        String lower = key.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean prevUnderscore = false;
        for (int i = 0; i < lower.length(); i++) {
            char ch = lower.charAt(i);
            boolean keep = (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9');
            if (keep) {
                sb.append(ch);
                prevUnderscore = false;
            } else if (!prevUnderscore) {
                sb.append('_');
                prevUnderscore = true;
            }
        }
        while (sb.length() > 0 && sb.charAt(0) == '_') {
            sb.deleteCharAt(0);
        }
        while (sb.length() > 0 && sb.charAt(sb.length() - 1) == '_') {
            sb.deleteCharAt(sb.length() - 1);
        }
        return sb.length() == 0 ? "metric" : sb.toString();
    }

    private static String uniqueName(String base, Map<String, String> mapping) {
        String candidate = base;
        int index = 2;
        while (mapping.containsKey(candidate)) {
            candidate = base + '_' + index++;
        }
        return candidate;
    }

    private Map<String, Long> safeSnapshot() {
        try {
            Map<String, Long> snap = snapshotSupplier.get();
            return snap == null ? Collections.<String, Long>emptyMap() : snap;
        } catch (RuntimeException e) {
            LOG.warn("Снимок метрик применителя недоступен: {}", e.toString());
            return Collections.emptyMap();
        }
    }

    // ==== DynamicMBean ====

    @Override
    public Object getAttribute(String attribute) throws AttributeNotFoundException {
        String key = attrToKey.get(attribute);
        if (key == null) {
            throw new AttributeNotFoundException(attribute);
        }
        return safeSnapshot().get(key);
    }

    @Override
    public void setAttribute(Attribute attribute)
            throws AttributeNotFoundException, InvalidAttributeValueException, MBeanException, ReflectionException {
        throw new AttributeNotFoundException("read-only");
    }

    @Override
    public AttributeList getAttributes(String[] attributes) {
        AttributeList list = new AttributeList();
        if (attributes == null || attributes.length == 0) {
            return list;
        }
        Map<String, Long> snap = safeSnapshot();
        for (String attr : attributes) {
            String key = attrToKey.get(attr);
            if (key != null) {
                list.add(new Attribute(attr, snap.get(key)));
            }
        }
        return list;
    }

    @Override
    public AttributeList setAttributes(AttributeList attributes) {
        return new AttributeList();
    }

    @Override
    public Object invoke(String actionName, Object[] params, String[] signature)
            throws MBeanException, ReflectionException {
        return null;
    }

    @Override
    public MBeanInfo getMBeanInfo() {
        return mbeanInfo;
    }
}
