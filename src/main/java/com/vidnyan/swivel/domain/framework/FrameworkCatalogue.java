package com.vidnyan.swivel.domain.framework;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed catalogue of Swing component kinds, containers and layout managers a candidate program
 * may use, plus the supporting types whose imports L2 checks. Read-only after class initialization.
 */
public final class FrameworkCatalogue {

    public static final String SWING = "javax.swing";
    public static final String AWT = "java.awt";

    /** Packages whose types are treated as framework types. */
    public static final Set<String> FRAMEWORK_PACKAGES = Set.of(
            SWING, "javax.swing.border", "javax.swing.event", "javax.swing.table", "javax.swing.tree",
            "javax.swing.text", AWT, "java.awt.event");

    private static final Map<String, ComponentKind> KINDS = new LinkedHashMap<>();
    private static final Map<String, String> SUPPORT_TYPES = new LinkedHashMap<>();

    static {
        swing(ComponentRole.INTERACTIVE, "JButton", "JToggleButton", "JCheckBox", "JRadioButton",
                "JTextField", "JPasswordField", "JFormattedTextField", "JTextArea", "JEditorPane",
                "JTextPane", "JComboBox", "JList", "JTable", "JTree", "JSlider", "JSpinner",
                "JMenuItem", "JCheckBoxMenuItem", "JRadioButtonMenuItem");
        swing(ComponentRole.CONTAINER, "JPanel", "JScrollPane", "JSplitPane", "JTabbedPane",
                "JToolBar", "JLayeredPane", "Box");
        swing(ComponentRole.DISPLAY, "JLabel", "JProgressBar", "JSeparator", "JScrollBar");
        swing(ComponentRole.WINDOW, "JFrame", "JDialog", "JWindow");
        swing(ComponentRole.MENU, "JMenuBar", "JMenu", "JPopupMenu");
        swing(ComponentRole.LAYOUT, "BoxLayout", "GroupLayout", "SpringLayout", "OverlayLayout");
        register(AWT, ComponentRole.LAYOUT, "BorderLayout", "FlowLayout", "GridLayout",
                "GridBagLayout", "CardLayout");

        support(SWING, "ButtonGroup", "ImageIcon", "SwingUtilities", "SwingWorker", "BorderFactory",
                "WindowConstants", "ListSelectionModel", "DefaultListModel", "DefaultComboBoxModel",
                "SpinnerNumberModel", "UIManager", "KeyStroke", "AbstractAction");
        support("javax.swing.table", "DefaultTableModel");
        support("javax.swing.tree", "DefaultMutableTreeNode");
        support(AWT, "Dimension", "Color", "Font", "Insets", "GridBagConstraints", "EventQueue");
        support("java.awt.event", "ActionEvent", "ActionListener", "KeyEvent", "MouseEvent",
                "MouseAdapter", "WindowAdapter", "WindowEvent");
    }

    private FrameworkCatalogue() {
    }

    private static void swing(ComponentRole role, String... names) {
        register(SWING, role, names);
    }

    private static void register(String packageName, ComponentRole role, String... names) {
        for (String name : names) {
            KINDS.put(name, new ComponentKind(name, packageName, role));
        }
    }

    private static void support(String packageName, String... names) {
        for (String name : names) {
            SUPPORT_TYPES.put(name, packageName + "." + name);
        }
    }

    public static Optional<ComponentKind> bySimpleName(String simpleName) {
        return Optional.ofNullable(KINDS.get(simpleName));
    }

    public static Optional<ComponentKind> byQualifiedName(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return bySimpleName(qualifiedName.substring(dot + 1))
                .filter(kind -> kind.qualifiedName().equals(qualifiedName));
    }

    /**
     * Fully qualified name of a catalogue kind or supporting type, by simple name.
     */
    public static Optional<String> qualifiedNameOf(String simpleName) {
        ComponentKind kind = KINDS.get(simpleName);
        if (kind != null) {
            return Optional.of(kind.qualifiedName());
        }
        return Optional.ofNullable(SUPPORT_TYPES.get(simpleName));
    }

    public static Collection<ComponentKind> kinds() {
        return List.copyOf(KINDS.values());
    }

    public static List<ComponentKind> kinds(ComponentRole role) {
        return KINDS.values().stream().filter(kind -> kind.role() == role).toList();
    }

    public static boolean isFrameworkPackage(String packageName) {
        return FRAMEWORK_PACKAGES.contains(packageName);
    }

    public static boolean isFrameworkType(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        return dot > 0 && isFrameworkPackage(qualifiedName.substring(0, dot));
    }
}
