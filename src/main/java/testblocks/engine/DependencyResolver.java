package testblocks.engine;

import testblocks.block.BlockDescriptor;
import testblocks.model.TypeKey;
import testblocks.service.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Produces the values a block needs, trying in order:
 * <ol>
 *   <li>the block's explicit arguments (entry-point parameters only, all or nothing),</li>
 *   <li>the run's {@link ResultStore}, by exact key,</li>
 *   <li>the run's service scope, by exact key.</li>
 * </ol>
 * If none applies the block fails with {@link UnresolvedDependencyException}
 * before its entry point is called.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Checks a descriptor's explicit arguments against its entry point.
     * Descriptors without explicit arguments always pass.
     *
     * @throws ConfigurationException if the argument count differs from the
     *                                parameter count, or an argument is not
     *                                an instance of its parameter's class
     */
    public void validate(BlockDescriptor descriptor) {
        if (!descriptor.hasExplicitArgs()) {
            return;
        }
        List<TypeKey<?>> parameters = descriptor.getDefinition().getParameters();
        List<Object>     args       = descriptor.getExplicitArgs();
        if (parameters.size() != args.size()) {
            throw new ConfigurationException("Unable to resolve entry point arguments for test block '"
                    + descriptor.getName() + "': " + args.size() + " explicit argument(s) given but the entry point takes "
                    + parameters.size() + " parameter(s) " + parameters
                    + ". Explicit arguments must cover every parameter.");
        }
        for (int i = 0; i < args.size(); i++) {
            if (!parameters.get(i).accepts(args.get(i))) {
                throw new ConfigurationException("Explicit argument " + i + " for test block '"
                        + descriptor.getName() + "' is a " + args.get(i).getClass().getName()
                        + " but the parameter expects " + parameters.get(i).id());
            }
        }
    }

    /**
     * Resolves the entry-point arguments of {@code descriptor}: its explicit
     * arguments when it has them, otherwise one value per parameter key.
     */
    public Object[] resolveEntryArguments(BlockDescriptor descriptor, ExecutionContext context) {
        if (descriptor.hasExplicitArgs()) {
            validate(descriptor);
            log.debug("[{}] Using {} explicit argument(s) for {}",
                    context.getRunName(), descriptor.getExplicitArgs().size(), descriptor.getName());
            return descriptor.getExplicitArgs().toArray();
        }
        return resolveAll(descriptor.getDefinition().getParameters(), descriptor.getName(), context);
    }

    /** Resolves each key in order through the result store and service tiers. */
    public Object[] resolveAll(List<TypeKey<?>> keys, String blockName, ExecutionContext context) {
        Object[] values = new Object[keys.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = resolve(keys.get(i), blockName, context);
        }
        return values;
    }

    /**
     * Resolves one key for {@code blockName}.
     *
     * @throws UnresolvedDependencyException if neither a prior result nor a
     *                                       service is available, or the
     *                                       service's provider fails
     */
    public <T> T resolve(TypeKey<T> key, String blockName, ExecutionContext context) {
        Optional<T> result = context.getResults().find(key);
        if (result.isPresent()) {
            log.debug("[{}] {} <- {} from result store", context.getRunName(), blockName, key);
            return result.get();
        }

        Optional<T> service;
        try {
            service = context.getServices().find(key);
        } catch (ServiceException e) {
            throw new UnresolvedDependencyException(key, blockName, e.getMessage(), e);
        }
        if (service.isPresent()) {
            log.debug("[{}] {} <- {} from service registry", context.getRunName(), blockName, key);
            return service.get();
        }

        throw new UnresolvedDependencyException(key, blockName,
                "no earlier test block produced it and no service is registered for it");
    }
}
