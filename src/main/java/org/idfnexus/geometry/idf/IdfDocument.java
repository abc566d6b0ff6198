package org.idfnexus.geometry.idf;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Mantid IDF（Instrument Definition File）XML 的只读访问封装。
 * <p>
 * 说明：
 * <ul>
 *   <li>根元素必须是命名空间 {@value #NAMESPACE} 下的 {@code instrument}。</li>
 *   <li>解析时关闭 DTD/外部实体，避免 XXE。</li>
 *   <li>只暴露按“本地名”查找子元素的工具方法，调用方不需要关心命名空间前缀。</li>
 * </ul>
 */
public final class IdfDocument {

    public static final String NAMESPACE = "http://www.mantidproject.org/IDF/1.0";

    private final Element root;

    private IdfDocument(Element root) {
        this.root = root;
    }

    public static IdfDocument parse(InputStream in) throws IOException {
        return parse(new InputSource(in));
    }

    public static IdfDocument parse(String xml) {
        try {
            return parse(new InputSource(new StringReader(xml)));
        } catch (IOException e) {
            throw new IllegalStateException("读取 IDF 文本失败", e);
        }
    }

    private static IdfDocument parse(InputSource source) throws IOException {
        Document document;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            document = builder.parse(source);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("无法创建 XML 解析器", e);
        } catch (SAXException e) {
            throw new IllegalArgumentException("IDF 不是合法的 XML：" + e.getMessage(), e);
        }
        Element root = document.getDocumentElement();
        if (!"instrument".equals(root.getLocalName()) || !NAMESPACE.equals(root.getNamespaceURI())) {
            throw new IllegalArgumentException("IDF 根元素必须是 {" + NAMESPACE + "}instrument，实际为："
                    + "{" + root.getNamespaceURI() + "}" + root.getLocalName());
        }
        return new IdfDocument(root);
    }

    public Element root() {
        return root;
    }

    public String instrumentName() {
        return attribute(root, "name");
    }

    public List<Element> types() {
        return children(root, "type");
    }

    /**
     * instrument 下直接声明的组件（“顶层组件”）。
     */
    public List<Element> components() {
        return children(root, "component");
    }

    public List<Element> idLists() {
        return children(root, "idlist");
    }

    public Element defaults() {
        return firstChild(root, "defaults");
    }

    public List<Element> typesWithKind(String kind) {
        List<Element> out = new ArrayList<>();
        for (Element type : types()) {
            if (kind.equals(kindOf(type))) {
                out.add(type);
            }
        }
        return out;
    }

    public List<Element> componentsOfType(String typeName) {
        List<Element> out = new ArrayList<>();
        for (Element component : components()) {
            if (typeName.equals(component.getAttribute("type"))) {
                out.add(component);
            }
        }
        return out;
    }

    /**
     * 归一化 type 的 {@code is} 属性：小写并去掉下划线。
     * <p>
     * 例如 {@code RectangularDetector}/{@code rectangular_detector} 都归一化为 {@code rectangulardetector}。
     */
    public static String kindOf(Element type) {
        String is = type.getAttribute("is");
        if (is == null || is.isBlank()) {
            return "";
        }
        return is.trim().toLowerCase(Locale.ROOT).replace("_", "");
    }

    public static List<Element> children(Element parent, String localName) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(node.getLocalName())) {
                out.add((Element) node);
            }
        }
        return out;
    }

    public static Element firstChild(Element parent, String localName) {
        if (parent == null) {
            return null;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(node.getLocalName())) {
                return (Element) node;
            }
        }
        return null;
    }

    /**
     * 读取属性；不存在或空白时返回 null（DOM 默认返回空字符串）。
     */
    public static String attribute(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        String value = element.getAttribute(name);
        return value.isBlank() ? null : value.trim();
    }

    public static double doubleAttribute(Element element, String name, double defaultValue) {
        String value = attribute(element, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("属性 " + name + " 不是数字：" + value, e);
        }
    }

    public static int intAttribute(Element element, String name, int defaultValue) {
        String value = attribute(element, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("属性 " + name + " 不是整数：" + value, e);
        }
    }

    /**
     * 元素的简短描述（用于错误信息里的“XML 位置”）。
     */
    public static String describe(Element element) {
        if (element == null) {
            return "<null>";
        }
        StringBuilder sb = new StringBuilder("<").append(element.getLocalName());
        for (String name : List.of("name", "type", "idname", "idlist")) {
            String value = attribute(element, name);
            if (value != null) {
                sb.append(' ').append(name).append("=\"").append(value).append('"');
            }
        }
        return sb.append('>').toString();
    }
}
