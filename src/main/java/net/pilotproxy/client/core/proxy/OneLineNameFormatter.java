package net.pilotproxy.client.core.proxy;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import javax.security.auth.x500.X500Principal;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.x500.AttributeTypeAndValue;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;

/**
 * Formats distinguished names in the slash-separated one-line form used by grid tools, e.g. {@code
 * /DC=org/O=Example/CN=John Doe}.
 */
final class OneLineNameFormatter {
  private static final Map<ASN1ObjectIdentifier, String> SHORT_NAMES = new HashMap<>();

  static {
    SHORT_NAMES.put(BCStyle.C, "C");
    SHORT_NAMES.put(BCStyle.ST, "ST");
    SHORT_NAMES.put(BCStyle.L, "L");
    SHORT_NAMES.put(BCStyle.O, "O");
    SHORT_NAMES.put(BCStyle.OU, "OU");
    SHORT_NAMES.put(BCStyle.CN, "CN");
    SHORT_NAMES.put(BCStyle.T, "title");
    SHORT_NAMES.put(BCStyle.SURNAME, "SN");
    SHORT_NAMES.put(BCStyle.GIVENNAME, "GN");
    SHORT_NAMES.put(BCStyle.INITIALS, "initials");
    SHORT_NAMES.put(BCStyle.GENERATION, "generationQualifier");
    SHORT_NAMES.put(BCStyle.SERIALNUMBER, "serialNumber");
    SHORT_NAMES.put(BCStyle.STREET, "street");
    SHORT_NAMES.put(BCStyle.POSTAL_CODE, "postalCode");
    SHORT_NAMES.put(BCStyle.DN_QUALIFIER, "dnQualifier");
    SHORT_NAMES.put(BCStyle.PSEUDONYM, "pseudonym");
    SHORT_NAMES.put(BCStyle.DC, "DC");
    SHORT_NAMES.put(BCStyle.UID, "UID");
    SHORT_NAMES.put(BCStyle.EmailAddress, "emailAddress");
  }

  private OneLineNameFormatter() {}

  static String format(X500Principal principal) {
    return format(X500Name.getInstance(principal.getEncoded()));
  }

  static String format(X500Name name) {
    StringBuilder sb = new StringBuilder();
    for (RDN rdn : name.getRDNs()) {
      for (AttributeTypeAndValue atv : rdn.getTypesAndValues()) {
        sb.append('/').append(typeName(atv.getType())).append('=');
        appendValue(sb, atv.getValue());
      }
    }
    return sb.toString();
  }

  private static String typeName(ASN1ObjectIdentifier type) {
    String shortName = SHORT_NAMES.get(type);
    return shortName != null ? shortName : type.getId();
  }

  private static void appendValue(StringBuilder sb, ASN1Encodable value) {
    String text = value instanceof ASN1String ? ((ASN1String) value).getString() : value.toString();
    for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
      int unsigned = b & 0xff;
      if (unsigned < 0x20 || unsigned > 0x7e) {
        sb.append(String.format("\\x%02X", unsigned));
      } else {
        sb.append((char) unsigned);
      }
    }
  }
}
