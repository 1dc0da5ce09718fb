package com.unparen.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.PropertyName;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.cfg.MapperConfig;
import com.fasterxml.jackson.databind.introspect.AnnotatedClass;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.introspect.VirtualAnnotatedMember;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.ser.VirtualBeanPropertyWriter;
import com.fasterxml.jackson.databind.util.Annotations;
import com.fasterxml.jackson.databind.util.SimpleBeanPropertyDefinition;
import com.unparen.ast.SyntaxKind;
import com.unparen.ast.SyntaxNode;
import com.unparen.ast.SyntaxToken;
import com.unparen.jackson.mixins.SyntaxNodeMixin;
import com.unparen.jackson.mixins.SyntaxTokenMixin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization/deserialization for the syntax tree records.
 *
 * This module handles:
 * - Polymorphic type handling via SyntaxNodeMixin, with the record's simple name as type id
 * - Subtype registration derived from the sealed SyntaxNode hierarchy
 * - A "kind" property on every node, virtual where the record has no kind component
 * - Omitting the "missing" flag of tokens that are present
 */
public class SyntaxModule extends SimpleModule {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxModule.class);

    static final String KIND_PROPERTY = "kind";

    public SyntaxModule() {
        super("SyntaxModule", new Version(1, 0, 0, null, "com.unparen", "unparen-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Every interface and record of the hierarchy gets the type id mixin
        // (mixin inheritance from interfaces alone is not relied upon)
        Set<Class<?>> syntaxTypes = syntaxTypes();
        List<NamedType> subtypes = new ArrayList<>();
        for (Class<?> type : syntaxTypes) {
            context.setMixInAnnotations(type, SyntaxNodeMixin.class);
            if (type.isRecord()) {
                subtypes.add(new NamedType(type, type.getSimpleName()));
            }
        }
        context.registerSubtypes(subtypes.toArray(new NamedType[0]));
        context.setMixInAnnotations(SyntaxToken.class, SyntaxTokenMixin.class);

        // Add serializer modifier to write "kind" for records that only compute it
        context.addBeanSerializerModifier(new KindSerializerModifier());

        logger.debug("Registered {} syntax records", subtypes.size());
    }

    /**
     * Every interface and record reachable from {@link SyntaxNode} through
     * sealed {@code permits} clauses.
     */
    static Set<Class<?>> syntaxTypes() {
        Set<Class<?>> seen = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        pending.push(SyntaxNode.class);
        while (!pending.isEmpty()) {
            Class<?> type = pending.pop();
            if (seen.add(type) && type.isSealed()) {
                pending.addAll(Arrays.asList(type.getPermittedSubclasses()));
            }
        }
        return seen;
    }

    // ==================== Serializer Modifier ====================

    private static class KindSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (!SyntaxNode.class.isAssignableFrom(beanClass)) {
                return beanProperties;
            }
            for (BeanPropertyWriter prop : beanProperties) {
                if (KIND_PROPERTY.equals(prop.getName())) {
                    // kind is a record component
                    return beanProperties;
                }
            }

            AnnotatedClass classInfo = beanDesc.getClassInfo();
            JavaType kindType = config.constructType(SyntaxKind.class);
            BeanPropertyDefinition propDef = SimpleBeanPropertyDefinition.construct(config,
                new VirtualAnnotatedMember(classInfo, beanClass, KIND_PROPERTY, kindType),
                PropertyName.construct(KIND_PROPERTY));

            List<BeanPropertyWriter> withKind = new ArrayList<>(beanProperties.size() + 1);
            withKind.add(new KindPropertyWriter(propDef, classInfo.getAnnotations(), kindType));
            withKind.addAll(beanProperties);
            return withKind;
        }
    }

    /**
     * A property writer that adds 'kind' to the JSON output by calling {@link SyntaxNode#kind()}.
     */
    static class KindPropertyWriter extends VirtualBeanPropertyWriter {

        KindPropertyWriter(BeanPropertyDefinition propDef, Annotations contextAnnotations, JavaType declaredType) {
            super(propDef, contextAnnotations, declaredType);
        }

        @Override
        protected Object value(Object bean, JsonGenerator gen, SerializerProvider prov) {
            return ((SyntaxNode) bean).kind();
        }

        @Override
        public VirtualBeanPropertyWriter withConfig(MapperConfig<?> config, AnnotatedClass declaringClass,
                                                    BeanPropertyDefinition propDef, JavaType type) {
            return new KindPropertyWriter(propDef, declaringClass.getAnnotations(), type);
        }
    }
}
