package absint.cfg;

import absint.ir.Assume;
import absint.ir.Purpose;

/**
 * An assume node whose statement carries a purpose.
 */
public record PurposeSite(CfgNode node, Assume assume, Purpose purpose) {
}
