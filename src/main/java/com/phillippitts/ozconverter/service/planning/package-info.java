/** Job/media catalog and turning user selections into job requests. */
package com.phillippitts.ozconverter.service.planning;
