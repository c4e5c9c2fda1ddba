package io.apicheck.core.engine.format;

import com.fasterxml.jackson.databind.JsonNode;
import io.apicheck.core.engine.JsonValues;
import io.apicheck.core.spi.FormatPredicate;
import java.math.BigDecimal;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Formats known out of the box: the JSON Schema string formats plus the OpenAPI numeric formats
 * ({@code int32}, {@code int64}, {@code float}, {@code double}) and {@code byte} (base64).
 *
 * <p>
 * String formats accept any non-string value and numeric formats any non-number.
 */
public enum BuiltinFormat implements FormatPredicate {
    DATE("date") {
        @Override
        boolean checkString(String s) {
            try {
                LocalDate.parse(s);
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }
    },

    /** RFC 3339: the offset is mandatory. */
    DATE_TIME("date-time") {
        @Override
        boolean checkString(String s) {
            try {
                OffsetDateTime.parse(s.toUpperCase(Locale.ROOT));
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }
    },

    TIME("time") {
        @Override
        boolean checkString(String s) {
            String upper = s.toUpperCase(Locale.ROOT);
            try {
                OffsetTime.parse(upper);
                return true;
            } catch (DateTimeParseException e) {
                return isLocalTime(upper);
            }
        }
    },

    EMAIL("email") {
        @Override
        boolean checkString(String s) {
            return EMAIL_PATTERN.matcher(s).matches() && !s.contains("..");
        }
    },

    UUID("uuid") {
        @Override
        boolean checkString(String s) {
            return UUID_PATTERN.matcher(s).matches();
        }
    },

    IPV4("ipv4") {
        @Override
        boolean checkString(String s) {
            String[] parts = s.split("\\.", -1);
            if (parts.length != 4) {
                return false;
            }
            for (String part : parts) {
                if (!OCTET_PATTERN.matcher(part).matches() || Integer.parseInt(part) > 255) {
                    return false;
                }
            }
            return true;
        }
    },

    IPV6("ipv6") {
        @Override
        boolean checkString(String s) {
            if (!s.contains(":") || !IPV6_CHARS.matcher(s).matches()) {
                return false;
            }
            try {
                // bracketed, so it is parsed as a literal and never resolved
                InetAddress.getByName("[" + s + "]");
                return true;
            } catch (UnknownHostException e) {
                return false;
            }
        }
    },

    URI_FORMAT("uri") {
        @Override
        boolean checkString(String s) {
            try {
                return new URI(s).isAbsolute();
            } catch (URISyntaxException e) {
                return false;
            }
        }
    },

    URI_REFERENCE("uri-reference") {
        @Override
        boolean checkString(String s) {
            try {
                new URI(s);
                return true;
            } catch (URISyntaxException e) {
                return false;
            }
        }
    },

    HOSTNAME("hostname") {
        @Override
        boolean checkString(String s) {
            String host = s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
            if (host.isEmpty() || host.length() > 253) {
                return false;
            }
            for (String label : host.split("\\.", -1)) {
                if (!LABEL_PATTERN.matcher(label).matches()) {
                    return false;
                }
            }
            return true;
        }
    },

    REGEX("regex") {
        @Override
        boolean checkString(String s) {
            try {
                Pattern.compile(s);
                return true;
            } catch (PatternSyntaxException e) {
                return false;
            }
        }
    },

    /** Base64-encoded characters. */
    BYTE("byte") {
        @Override
        boolean checkString(String s) {
            try {
                Base64.getDecoder().decode(s);
                return true;
            } catch (IllegalArgumentException e) {
                return false;
            }
        }
    },

    INT32("int32") {
        @Override
        boolean checkNumber(BigDecimal n) {
            return isIntegral(n)
                    && n.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) >= 0
                    && n.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) <= 0;
        }
    },

    INT64("int64") {
        @Override
        boolean checkNumber(BigDecimal n) {
            return isIntegral(n)
                    && n.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) >= 0
                    && n.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0;
        }
    },

    FLOAT("float") {
        @Override
        boolean checkNumber(BigDecimal n) {
            return n.abs().compareTo(new BigDecimal(Float.toString(Float.MAX_VALUE))) <= 0;
        }
    },

    DOUBLE("double") {
        @Override
        boolean checkNumber(BigDecimal n) {
            return n.abs().compareTo(new BigDecimal(Double.toString(Double.MAX_VALUE))) <= 0;
        }
    };

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern OCTET_PATTERN = Pattern.compile("^(0|[1-9][0-9]{0,2})$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");
    private static final Pattern LABEL_PATTERN = Pattern.compile("^[a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?$");

    private final String formatName;

    BuiltinFormat(String formatName) {
        this.formatName = formatName;
    }

    @Override
    public String id() {
        return formatName;
    }

    @Override
    public boolean test(JsonNode value) {
        if (value == null) {
            return true;
        }
        if (isNumeric()) {
            if (!value.isNumber()) {
                return true;
            }
            BigDecimal decimal = JsonValues.decimal(value);
            return decimal != null && checkNumber(decimal);
        }
        return !value.isTextual() || checkString(value.textValue());
    }

    private boolean isNumeric() {
        return this == INT32 || this == INT64 || this == FLOAT || this == DOUBLE;
    }

    boolean checkString(String s) {
        return true;
    }

    boolean checkNumber(BigDecimal n) {
        return true;
    }

    private static boolean isIntegral(BigDecimal n) {
        return n.signum() == 0 || n.stripTrailingZeros().scale() <= 0;
    }

    private static boolean isLocalTime(String s) {
        try {
            LocalTime.parse(s);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
