package work.lcod.scals.action;

import java.util.Objects;

/**
 * Action kind tag. Built-in kinds are a closed enumeration; anything else is {@link Builtin#CUSTOM}
 * carrying the raw type name so hosts can register handlers for it.
 */
public record ActionKind(Builtin builtin, String name) {
    public static final ActionKind DISMISS = new ActionKind(Builtin.DISMISS, "dismiss");
    public static final ActionKind SET_STATE = new ActionKind(Builtin.SET_STATE, "setState");
    public static final ActionKind TOGGLE_STATE = new ActionKind(Builtin.TOGGLE_STATE, "toggleState");
    public static final ActionKind SHOW_ALERT = new ActionKind(Builtin.SHOW_ALERT, "showAlert");
    public static final ActionKind NAVIGATE = new ActionKind(Builtin.NAVIGATE, "navigate");
    public static final ActionKind OPEN_URL = new ActionKind(Builtin.OPEN_URL, "openURL");
    public static final ActionKind SEQUENCE = new ActionKind(Builtin.SEQUENCE, "sequence");
    public static final ActionKind APPEND_TO_ARRAY = new ActionKind(Builtin.APPEND_TO_ARRAY, "appendToArray");
    public static final ActionKind REMOVE_FROM_ARRAY = new ActionKind(Builtin.REMOVE_FROM_ARRAY, "removeFromArray");
    public static final ActionKind TOGGLE_IN_ARRAY = new ActionKind(Builtin.TOGGLE_IN_ARRAY, "toggleInArray");
    public static final ActionKind SET_ARRAY_ITEM = new ActionKind(Builtin.SET_ARRAY_ITEM, "setArrayItem");
    public static final ActionKind CLEAR_ARRAY = new ActionKind(Builtin.CLEAR_ARRAY, "clearArray");

    public enum Builtin {
        DISMISS,
        SET_STATE,
        TOGGLE_STATE,
        SHOW_ALERT,
        NAVIGATE,
        OPEN_URL,
        SEQUENCE,
        APPEND_TO_ARRAY,
        REMOVE_FROM_ARRAY,
        TOGGLE_IN_ARRAY,
        SET_ARRAY_ITEM,
        CLEAR_ARRAY,
        CUSTOM
    }

    public ActionKind {
        Objects.requireNonNull(builtin, "builtin");
        Objects.requireNonNull(name, "name");
    }

    public static ActionKind of(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Action type must not be null");
        }
        switch (name) {
            case "dismiss":
                return DISMISS;
            case "setState":
                return SET_STATE;
            case "toggleState":
                return TOGGLE_STATE;
            case "showAlert":
                return SHOW_ALERT;
            case "navigate":
                return NAVIGATE;
            case "openURL":
                return OPEN_URL;
            case "sequence":
                return SEQUENCE;
            case "appendToArray":
                return APPEND_TO_ARRAY;
            case "removeFromArray":
                return REMOVE_FROM_ARRAY;
            case "toggleInArray":
                return TOGGLE_IN_ARRAY;
            case "setArrayItem":
                return SET_ARRAY_ITEM;
            case "clearArray":
                return CLEAR_ARRAY;
            default:
                return new ActionKind(Builtin.CUSTOM, name);
        }
    }

    public boolean isCustom() {
        return builtin == Builtin.CUSTOM;
    }

    @Override
    public String toString() {
        return name;
    }
}
